package com.jobrunner.discovery;

/**
 * A configured Git repository whose clone may provide jobs.
 */
public class GitRepositoryRecord {
    private final String slug;
    private final String remoteUrl;
    private final String branch;
    private final String currentHead;
    private final boolean providesJobs;

    /**
     * @param slug directory name of the clone and suffix of the {@code git.<slug>} source grouping
     * @param remoteUrl URL to clone from
     * @param branch branch to check out
     * @param currentHead commit the clone must be at, or null for the tip of the branch
     * @param providesJobs whether the repository's {@code jobs} directory should be scanned
     */
    public GitRepositoryRecord(String slug, String remoteUrl, String branch, String currentHead, boolean providesJobs) {
        this.slug = slug;
        this.remoteUrl = remoteUrl;
        this.branch = branch;
        this.currentHead = currentHead;
        this.providesJobs = providesJobs;
    }

    public String getSlug() {
        return slug;
    }

    public String getRemoteUrl() {
        return remoteUrl;
    }

    public String getBranch() {
        return branch;
    }

    public String getCurrentHead() {
        return currentHead;
    }

    public boolean providesJobs() {
        return providesJobs;
    }

    @Override
    public String toString() {
        return "GitRepository{" + slug + "}";
    }
}
