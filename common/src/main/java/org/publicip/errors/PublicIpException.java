package org.publicip.errors;

/**
 * The root of the exceptions reported by the lookup library.
 */
public abstract class PublicIpException extends Exception {
    protected PublicIpException(String message) {
        super(message);
    }

    protected PublicIpException(String message, Throwable cause) {
        super(message, cause);
    }
}
