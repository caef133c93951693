package com.company.simulation.cache;

/**
 * Cache key that belongs to exactly one project, so entries can be dropped per project.
 */
public interface ProjectScopedKey {

    String getProjectId();
}
