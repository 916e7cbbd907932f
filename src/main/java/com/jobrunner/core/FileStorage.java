package com.jobrunner.core;

/**
 * Blob storage for files uploaded as job input.
 *
 * <p>Files are stored when input is serialized at submission, loaded when the worker
 * deserializes input, and deleted by the executor once the run is over.</p>
 */
public interface FileStorage {

    /**
     * Store file content.
     *
     * @param content the bytes to store
     * @param name the original file name
     * @return an opaque handle used to load or delete the file later
     */
    String store(byte[] content, String name);

    /**
     * Load file content by handle.
     *
     * @throws ObjectNotFoundException if nothing is stored under the handle
     */
    byte[] load(String handle) throws ObjectNotFoundException;

    /**
     * Original name of a stored file. Stores that do not keep names return the handle.
     *
     * @throws ObjectNotFoundException if nothing is stored under the handle
     */
    default String nameOf(String handle) throws ObjectNotFoundException {
        return handle;
    }

    /**
     * Delete a stored file.
     *
     * @return true if a file was deleted, false if the handle was unknown
     */
    boolean delete(String handle);
}
