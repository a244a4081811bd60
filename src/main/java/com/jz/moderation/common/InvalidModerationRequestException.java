package com.jz.moderation.common;

public class InvalidModerationRequestException extends ModerationInputException {
    public InvalidModerationRequestException(String message) {
        super(message);
    }
}
