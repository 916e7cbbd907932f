package com.jobrunner.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * A file supplied as job input: a name plus its content.
 */
public final class UploadedFile {

    private final String name;
    private final byte[] content;

    public UploadedFile(String name, byte[] content) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public String getName() {
        return name;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UploadedFile)) {
            return false;
        }
        UploadedFile other = (UploadedFile) o;
        return name.equals(other.name) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "UploadedFile{name='" + name + "', size=" + content.length + "}";
    }
}
