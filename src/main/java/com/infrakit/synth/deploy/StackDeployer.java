package com.infrakit.synth.deploy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.config.SynthConfig;
import com.infrakit.synth.diff.StackDiff;
import com.infrakit.synth.diff.TemplateDiffEngine;
import com.infrakit.synth.model.Asset;
import com.infrakit.synth.serialization.TemplateParseException;
import com.infrakit.synth.serialization.TemplateParser;
import com.infrakit.synth.serialization.TemplateSerializer;
import com.infrakit.synth.stack.IdentifierReconciler;
import com.infrakit.synth.stack.Template;

/**
 * Drives a template through the deployment service: uploads its assets, creates or
 * updates the stack and waits for a terminal status.
 *
 * <p>An existing stack is updated with its deployed ids reused (see
 * {@link IdentifierReconciler}), so resources that kept their ResourceId are updated in
 * place. Statuses are polled at a fixed interval; there is no retry.</p>
 */
public class StackDeployer {

    private static final Logger log = LoggerFactory.getLogger(StackDeployer.class);

    private final DeploymentClient client;
    private final AssetUploader uploader;
    private final SynthConfig config;
    private final Sleeper sleeper;
    private final TemplateSerializer serializer;
    private final TemplateParser parser = new TemplateParser();
    private final IdentifierReconciler reconciler = new IdentifierReconciler();
    private final TemplateDiffEngine diffEngine = new TemplateDiffEngine();

    public StackDeployer(DeploymentClient client, AssetUploader uploader, SynthConfig config) {
        this(client, uploader, config, Sleeper.THREAD);
    }

    StackDeployer(DeploymentClient client, AssetUploader uploader, SynthConfig config, Sleeper sleeper) {
        this.client = client;
        this.uploader = uploader;
        this.config = config;
        this.sleeper = sleeper;
        this.serializer = new TemplateSerializer(config);
    }

    public DeploymentResult deploy(String stackName, Template template) throws DeploymentException {
        uploadAssets(template.getAssets());

        Optional<String> existing = fetch(stackName);
        try {
            if (existing.isPresent()) {
                Template deployed = parseDeployed(stackName, existing.get());
                Template reconciled = reconciler.reconcile(template, deployed);
                log.info("Updating stack {}", stackName);
                boolean changed = client.updateStack(stackName, serializer.serialize(reconciled), template.getTags());
                if (!changed) {
                    log.info("Stack {} is already up to date", stackName);
                    return new DeploymentResult(stackName, DeploymentResult.Operation.UNCHANGED, null,
                            template.getAssets().size());
                }
                StackStatus status = awaitDeployment(stackName);
                return new DeploymentResult(stackName, DeploymentResult.Operation.UPDATED, status,
                        template.getAssets().size());
            }

            log.info("Creating stack {}", stackName);
            client.createStack(stackName, serializer.serialize(template), template.getTags());
        } catch (IOException e) {
            throw new DeploymentException("Unable to submit stack '" + stackName + "': " + e.getMessage(), e);
        }
        StackStatus status = awaitDeployment(stackName);
        return new DeploymentResult(stackName, DeploymentResult.Operation.CREATED, status,
                template.getAssets().size());
    }

    public void destroy(String stackName) throws DeploymentException {
        if (describe(stackName).isEmpty()) {
            log.info("Stack {} does not exist, nothing to destroy", stackName);
            return;
        }
        try {
            client.deleteStack(stackName);
        } catch (IOException e) {
            throw new DeploymentException("Unable to delete stack '" + stackName + "': " + e.getMessage(), e);
        }

        for (int attempt = 1; attempt <= config.getMaxPollAttempts(); attempt++) {
            Optional<StackStatus> status = describe(stackName);
            if (status.isEmpty()) {
                log.info("Stack {} deleted", stackName);
                return;
            }
            switch (status.get().destroyOutcome()) {
                case SUCCEEDED -> {
                    log.info("Stack {} deleted", stackName);
                    return;
                }
                case FAILED -> throw new DeploymentException(
                        "Deletion of stack '" + stackName + "' failed with status " + status.get());
                default -> log.info("Deleting {}... ({})", stackName, status.get());
            }
            pause();
        }
        throw new DeploymentException("Gave up waiting for deletion of stack '" + stackName + "' after "
                + config.getMaxPollAttempts() + " polls");
    }

    /**
     * Compares a template with what is currently deployed under {@code stackName}.
     */
    public StackDiff diff(String stackName, Template template) throws DeploymentException {
        String body = fetch(stackName)
                .orElseThrow(() -> new DeploymentException("Stack '" + stackName + "' does not exist"));
        return diffEngine.diff(template, parseDeployed(stackName, body));
    }

    void uploadAssets(List<Asset> assets) throws DeploymentException {
        if (assets.isEmpty()) {
            return;
        }
        int threads = Math.max(1, Math.min(config.getUploadParallelism(), assets.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Asset>> uploads = new ArrayList<>();
            for (Asset asset : assets) {
                log.info("Uploading {}", asset);
                uploads.add(executor.submit(() -> {
                    uploader.upload(asset);
                    return asset;
                }));
            }

            DeploymentException firstFailure = null;
            for (int i = 0; i < uploads.size(); i++) {
                try {
                    uploads.get(i).get();
                } catch (ExecutionException e) {
                    if (firstFailure == null) {
                        Throwable cause = e.getCause();
                        firstFailure = new DeploymentException(
                                "Unable to upload asset " + assets.get(i) + ": " + cause.getMessage(), cause);
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException("Interrupted while uploading assets", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private StackStatus awaitDeployment(String stackName) throws DeploymentException {
        for (int attempt = 1; attempt <= config.getMaxPollAttempts(); attempt++) {
            StackStatus status = describe(stackName).orElseThrow(() ->
                    new DeploymentException("Stack '" + stackName + "' disappeared during deployment"));
            switch (status.deployOutcome()) {
                case SUCCEEDED -> {
                    log.info("Stack {} reached {}", stackName, status);
                    return status;
                }
                case FAILED -> throw new DeploymentException(
                        "Deployment of stack '" + stackName + "' failed with status " + status);
                default -> log.info("Deploying {}... ({})", stackName, status);
            }
            pause();
        }
        throw new DeploymentException("Gave up waiting for stack '" + stackName + "' after "
                + config.getMaxPollAttempts() + " polls");
    }

    private Template parseDeployed(String stackName, String body) throws DeploymentException {
        try {
            return parser.parse(body);
        } catch (TemplateParseException e) {
            throw new DeploymentException("Deployed template of stack '" + stackName + "' is unreadable: "
                    + e.getMessage(), e);
        }
    }

    private Optional<String> fetch(String stackName) throws DeploymentException {
        try {
            return client.fetchTemplate(stackName);
        } catch (IOException e) {
            throw new DeploymentException("Unable to fetch template of stack '" + stackName + "': "
                    + e.getMessage(), e);
        }
    }

    private Optional<StackStatus> describe(String stackName) throws DeploymentException {
        try {
            return client.describeStatus(stackName);
        } catch (IOException e) {
            throw new DeploymentException("Unable to read status of stack '" + stackName + "': "
                    + e.getMessage(), e);
        }
    }

    private void pause() throws DeploymentException {
        try {
            sleeper.sleep(config.getPollInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException("Interrupted while waiting for stack status", e);
        }
    }
}
