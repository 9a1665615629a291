package com.pennywise.exception;

import java.util.NoSuchElementException;

/**
 * Referenced account, category or entry does not exist or is not visible to the acting user.
 */
public class ResourceNotFoundException extends NoSuchElementException {

    public ResourceNotFoundException(String resource, Long id) {
        super(resource + " not found: " + id);
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
