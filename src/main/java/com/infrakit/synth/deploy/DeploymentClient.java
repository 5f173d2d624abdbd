package com.infrakit.synth.deploy;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * The remote deployment service: submits, deletes and describes named stacks.
 */
public interface DeploymentClient {

    /**
     * @return the body of the currently deployed template, empty when the stack does not exist
     */
    Optional<String> fetchTemplate(String stackName) throws IOException;

    /**
     * @return the current status, empty when the stack does not exist (or no longer exists)
     */
    Optional<StackStatus> describeStatus(String stackName) throws IOException;

    void createStack(String stackName, String templateBody, Map<String, String> tags) throws IOException;

    /**
     * @return {@code false} when the service reports that the body changes nothing
     */
    boolean updateStack(String stackName, String templateBody, Map<String, String> tags) throws IOException;

    void deleteStack(String stackName) throws IOException;
}
