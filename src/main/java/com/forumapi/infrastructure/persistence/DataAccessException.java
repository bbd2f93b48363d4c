package com.forumapi.infrastructure.persistence;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} thrown by the JDBC repositories.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
