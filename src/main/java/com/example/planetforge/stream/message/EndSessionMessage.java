package com.example.planetforge.stream.message;

public class EndSessionMessage extends ClientMessage {

    public static final String TYPE = "end_session";

    @Override
    public String type() {
        return TYPE;
    }
}
