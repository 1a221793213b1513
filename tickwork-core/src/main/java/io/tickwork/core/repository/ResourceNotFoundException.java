package io.tickwork.core.repository;

/**
 * Thrown when a schedule, workflow or link target does not exist or is
 * soft-deleted.
 *
 * This exception is deterministic. Retrying with the same input fails again.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
