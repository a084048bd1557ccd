package com.umitunal.tenantq.protocol;

/**
 * A client frame that cannot be understood.
 */
public class MessageFormatException extends Exception {

    public MessageFormatException(String message) {
        super(message);
    }

    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
