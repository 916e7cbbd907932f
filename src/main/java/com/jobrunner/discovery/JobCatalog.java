package com.jobrunner.discovery;

import com.jobrunner.core.ClassPath;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobModelRepository;

import java.sql.SQLException;
import java.util.List;
import java.util.logging.Logger;

/**
 * Keeps the persisted {@link JobModel} rows in step with a discovered {@link JobRegistry}.
 *
 * <p>New jobs get a disabled model. Existing models take the definition's values for every
 * field that is not overridden. Models whose job is no longer discovered are marked not
 * installed and disabled, never deleted.</p>
 */
public class JobCatalog {
    private static final Logger logger = Logger.getLogger(JobCatalog.class.getName());

    private final JobModelRepository repository;

    public JobCatalog(JobModelRepository repository) {
        this.repository = repository;
    }

    /**
     * Mirror the snapshot into the database.
     *
     * @return the number of models created
     * @throws SQLException if database operation fails
     */
    public int synchronize(JobRegistry registry) throws SQLException {
        int created = 0;
        for (JobDefinition definition : registry.getAllJobs()) {
            ClassPath classPath = definition.getClassPath();
            JobModel model = repository.findByClassPath(classPath);
            if (model == null) {
                model = new JobModel();
                model.setEnabled(false);
                created++;
                logger.info("Created job model for " + classPath);
            }
            model.syncFrom(definition, registry.getModuleDisplayName(classPath));
            try {
                model.validate();
            } catch (ValidationException e) {
                // The model is still saved; submission rejects it until it is fixed
                logger.warning("Job " + classPath + " has an invalid policy: " + e.getMessage());
            }
            repository.save(model);
        }

        List<JobModel> models = repository.findAll();
        for (JobModel model : models) {
            if (model.isInstalled() && !registry.contains(model.getClassPath().toString())) {
                logger.warning("Job " + model.getClassPath() + " is no longer available, marking it not installed");
                model.setInstalled(false);
                model.setEnabled(false);
                repository.save(model);
            }
        }
        return created;
    }

    /**
     * @return the model, or null if the job was never synchronized
     */
    public JobModel getModel(ClassPath classPath) throws SQLException {
        return repository.findByClassPath(classPath);
    }

    /**
     * Enable or disable a synchronized job.
     *
     * @throws IllegalArgumentException if there is no model for the class path
     * @throws SQLException if database operation fails
     */
    public JobModel setEnabled(ClassPath classPath, boolean enabled) throws SQLException {
        JobModel model = repository.findByClassPath(classPath);
        if (model == null) {
            throw new IllegalArgumentException("No job model for " + classPath);
        }
        model.setEnabled(enabled);
        repository.save(model);
        return model;
    }

    /**
     * Save an edited model after checking its policy.
     *
     * @throws ValidationException if the policy is inconsistent
     * @throws SQLException if database operation fails
     */
    public void saveModel(JobModel model) throws ValidationException, SQLException {
        model.validate();
        repository.save(model);
    }
}
