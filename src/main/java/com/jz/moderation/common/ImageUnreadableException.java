package com.jz.moderation.common;

public class ImageUnreadableException extends ModerationInputException {
    public ImageUnreadableException(String message) {
        super(message);
    }

    public ImageUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
