package com.jobrunner;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.FileStorage;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.db.Database;
import com.jobrunner.discovery.JobModule;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared helpers for tests that need a database, inventory objects or file storage.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * A fresh, initialized in-memory database with its own name.
     */
    public static Database newDatabase() throws SQLException {
        Database database = new Database("jdbc:h2:mem:test-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        database.initialize();
        return database;
    }

    public static JobModule module(String moduleName, JobDefinition... definitions) {
        List<JobDefinition> jobs = Arrays.asList(definitions);
        return new JobModule() {
            @Override
            public String getModuleName() {
                return moduleName;
            }

            @Override
            public List<JobDefinition> getJobDefinitions() {
                return jobs;
            }
        };
    }

    /**
     * Inventory object with free-form attributes.
     */
    public static class Item implements DomainObject {
        private final String objectType;
        private final String id;
        private final String display;
        private final Map<String, Object> attributes;

        public Item(String objectType, String id, String display) {
            this(objectType, id, display, Map.of());
        }

        public Item(String objectType, String id, String display, Map<String, Object> attributes) {
            this.objectType = objectType;
            this.id = id;
            this.display = display;
            this.attributes = attributes;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getObjectType() {
            return objectType;
        }

        @Override
        public String getDisplay() {
            return display;
        }

        @Override
        public Object getAttribute(String name) {
            return attributes.containsKey(name) ? attributes.get(name) : DomainObject.super.getAttribute(name);
        }
    }

    /**
     * In-memory file storage that counts deletions.
     */
    public static class CountingFileStorage implements FileStorage {
        private final Map<String, byte[]> files = new ConcurrentHashMap<>();
        private final Map<String, String> names = new ConcurrentHashMap<>();
        private final AtomicInteger deletes = new AtomicInteger();
        private volatile RuntimeException deleteFailure;

        @Override
        public String store(byte[] content, String name) {
            String handle = UUID.randomUUID().toString();
            files.put(handle, content.clone());
            names.put(handle, name);
            return handle;
        }

        @Override
        public byte[] load(String handle) throws ObjectNotFoundException {
            byte[] content = files.get(handle);
            if (content == null) {
                throw new ObjectNotFoundException("File " + handle + " does not exist");
            }
            return content.clone();
        }

        @Override
        public String nameOf(String handle) throws ObjectNotFoundException {
            String name = names.get(handle);
            if (name == null) {
                throw new ObjectNotFoundException("File " + handle + " does not exist");
            }
            return name;
        }

        @Override
        public boolean delete(String handle) {
            deletes.incrementAndGet();
            if (deleteFailure != null) {
                throw deleteFailure;
            }
            names.remove(handle);
            return files.remove(handle) != null;
        }

        /**
         * Make every following delete throw {@code failure}.
         */
        public void failDeletesWith(RuntimeException failure) {
            this.deleteFailure = failure;
        }

        public boolean contains(String handle) {
            return files.containsKey(handle);
        }

        public int getDeleteCount() {
            return deletes.get();
        }
    }
}
