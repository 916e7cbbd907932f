package com.jobrunner.vars;

import com.jobrunner.core.FileStorage;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.UploadedFile;
import com.jobrunner.core.ValidationException;

/**
 * An uploaded file.
 *
 * <p>Serializing stores the content through {@link FileStorage} and yields the storage
 * handle; deserializing loads it back. The executor deletes the stored file once the run
 * is over, whatever its outcome.</p>
 */
public class FileVar extends JobVariable<UploadedFile, FileVar> {

    public FileVar() {
        super(UploadedFile.class);
    }

    @Override
    protected FileVar self() {
        return this;
    }

    @Override
    protected UploadedFile convert(Object raw, VariableServices services) throws ValidationException {
        if (!(raw instanceof UploadedFile)) {
            throw invalid("No file was submitted. Check the encoding type on the form.");
        }
        UploadedFile file = (UploadedFile) raw;
        if (file.getSize() == 0) {
            throw invalid("The submitted file is empty.");
        }
        return file;
    }

    @Override
    public Object serialize(UploadedFile value, VariableServices services) {
        if (value == null) {
            return null;
        }
        return services.getFileStorage().store(value.getContent(), value.getName());
    }

    /**
     * Load the file stored under the handle.
     *
     * @throws ObjectNotFoundException if the file is no longer stored
     */
    @Override
    public UploadedFile deserialize(Object stored, VariableServices services)
            throws ObjectNotFoundException, ValidationException {
        if (stored == null) {
            return null;
        }
        String handle = scalarText(stored);
        FileStorage storage = services.getFileStorage();
        return new UploadedFile(storage.nameOf(handle), storage.load(handle));
    }

    @Override
    protected Object describeDefault(UploadedFile value) {
        return value.getName();
    }
}
