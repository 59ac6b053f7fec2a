package com.example.planetforge.stream.message;

public class PingMessage extends ClientMessage {

    public static final String TYPE = "ping";

    @Override
    public String type() {
        return TYPE;
    }
}
