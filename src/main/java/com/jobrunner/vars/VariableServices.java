package com.jobrunner.vars;

import com.jobrunner.core.FileStorage;
import com.jobrunner.core.ObjectRepository;

/**
 * Collaborators variables need to validate, serialize and deserialize values:
 * the inventory for object references and blob storage for uploaded files.
 */
public class VariableServices {
    private final ObjectRepository objectRepository;
    private final FileStorage fileStorage;

    public VariableServices(ObjectRepository objectRepository, FileStorage fileStorage) {
        this.objectRepository = objectRepository;
        this.fileStorage = fileStorage;
    }

    public ObjectRepository getObjectRepository() {
        return objectRepository;
    }

    public FileStorage getFileStorage() {
        return fileStorage;
    }
}
