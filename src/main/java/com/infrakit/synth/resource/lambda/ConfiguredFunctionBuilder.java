package com.infrakit.synth.resource.lambda;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.infrakit.synth.config.SynthConfig;
import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.IntrinsicFunctions;
import com.infrakit.synth.model.Reference;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.resource.cloudwatch.LogGroup;
import com.infrakit.synth.resource.cloudwatch.LogGroupBuilder;
import com.infrakit.synth.resource.iam.Effect;
import com.infrakit.synth.resource.iam.Policy;
import com.infrakit.synth.resource.iam.PolicyDocument;
import com.infrakit.synth.resource.iam.Role;
import com.infrakit.synth.resource.iam.RoleBuilder;
import com.infrakit.synth.resource.iam.RoleProperties;
import com.infrakit.synth.resource.iam.Statement;
import com.infrakit.synth.resource.sqs.Queue;

/**
 * A function whose code, handler and runtime are known. Without an explicit role an
 * execution role is generated; log groups are generated only on request.
 */
public class ConfiguredFunctionBuilder {

    static final String GENERATED_ROLE_KIND = "LambdaFunctionRole";
    static final String LAMBDA_SERVICE = "lambda.amazonaws.com";
    static final String LOG_GROUP_PREFIX = "/aws/lambda/";

    private static final Pattern ENV_KEY = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]*");
    private static final Pattern FUNCTION_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    private final ResourceId resourceId;
    private final IdGenerator idGenerator;
    private final Architecture architecture;
    private final int memory;
    private final int timeout;
    private final Code code;
    private final String handler;
    private final Runtime runtime;

    private SynthConfig config = SynthConfig.defaults();
    private String functionName;
    private final Map<String, Object> environment = new LinkedHashMap<>();
    private Integer reservedConcurrency;
    private Role role;
    private final List<Policy> rolePolicies = new ArrayList<>();
    private LogGroup logGroup;
    private Integer generatedLogGroupRetention;
    private final List<SqsEventSource> sqsEventSources = new ArrayList<>();

    ConfiguredFunctionBuilder(ResourceId resourceId, IdGenerator idGenerator, Architecture architecture,
                              int memory, int timeout, Code code, String handler, Runtime runtime) {
        this.resourceId = resourceId;
        this.idGenerator = idGenerator;
        this.architecture = architecture;
        this.memory = memory;
        this.timeout = timeout;
        this.code = code;
        this.handler = handler;
        this.runtime = runtime;
    }

    /**
     * Supplies the asset bucket for zip code without one and the default log retention.
     */
    public ConfiguredFunctionBuilder config(SynthConfig config) {
        this.config = config;
        return this;
    }

    public ConfiguredFunctionBuilder functionName(String functionName) {
        this.functionName = functionName;
        return this;
    }

    /**
     * @param value a literal string or a {@link Reference}
     */
    public ConfiguredFunctionBuilder environmentVariable(String key, Object value) {
        environment.put(key, value);
        return this;
    }

    public ConfiguredFunctionBuilder reservedConcurrency(int reservedConcurrency) {
        this.reservedConcurrency = reservedConcurrency;
        return this;
    }

    /**
     * Uses an existing role instead of generating one. The role must be registered separately.
     */
    public ConfiguredFunctionBuilder role(Role role) {
        this.role = role;
        return this;
    }

    /**
     * Adds an inline policy to the generated role.
     */
    public ConfiguredFunctionBuilder rolePolicy(Policy policy) {
        rolePolicies.add(policy);
        return this;
    }

    /**
     * Sends logs to an existing log group. It must be registered separately.
     */
    public ConfiguredFunctionBuilder logGroup(LogGroup logGroup) {
        this.logGroup = logGroup;
        return this;
    }

    public ConfiguredFunctionBuilder generatedLogGroup() {
        return generatedLogGroup(config.getDefaultLogRetentionDays());
    }

    public ConfiguredFunctionBuilder generatedLogGroup(int retentionInDays) {
        this.generatedLogGroupRetention = retentionInDays;
        return this;
    }

    public ConfiguredFunctionBuilder sqsEventSource(Queue queue) {
        sqsEventSources.add(new SqsEventSource(queue, null));
        return this;
    }

    public ConfiguredFunctionBuilder sqsEventSource(Queue queue, int maximumConcurrency) {
        sqsEventSources.add(new SqsEventSource(queue, maximumConcurrency));
        return this;
    }

    public FunctionResources build() {
        Code resolvedCode = resolveCode();
        validate(resolvedCode);

        Role generatedRole = role == null ? generateRole() : null;
        Role executionRole = role != null ? role : generatedRole;

        LogGroup generatedLogGroup = generatedLogGroupRetention != null ? generateLogGroup() : null;
        LogGroup targetLogGroup = logGroup != null ? logGroup : generatedLogGroup;

        FunctionProperties properties = FunctionProperties.builder()
                .functionName(functionName)
                .architectures(List.of(architecture))
                .memorySize(memory)
                .timeout(timeout)
                .code(resolvedCode)
                .handler(handler)
                .runtime(runtime)
                .role(executionRole.arn())
                .environment(environment.isEmpty()
                        ? null
                        : new FunctionProperties.Environment(environment))
                .reservedConcurrentExecutions(reservedConcurrency)
                .loggingConfig(targetLogGroup == null
                        ? null
                        : new FunctionProperties.LoggingConfig(targetLogGroup.ref()))
                .build();
        Function function = new Function(resourceId, idGenerator.generate(Function.KIND), properties);

        List<EventSourceMapping> mappings = new ArrayList<>();
        for (int i = 0; i < sqsEventSources.size(); i++) {
            SqsEventSource source = sqsEventSources.get(i);
            EventSourceMappingProperties.ScalingConfig scaling = source.maximumConcurrency == null
                    ? null
                    : new EventSourceMappingProperties.ScalingConfig(source.maximumConcurrency);
            EventSourceMappingProperties mappingProperties =
                    new EventSourceMappingProperties(function.ref(), source.queue.arn(), scaling);
            ResourceId mappingId = resourceId.withSuffix("EventSource" + (i == 0 ? "" : String.valueOf(i)));
            mappings.add(new EventSourceMapping(mappingId, idGenerator.generate(EventSourceMapping.KIND),
                    mappingProperties));
        }

        return new FunctionResources(function, generatedRole, generatedLogGroup, mappings);
    }

    private Code resolveCode() {
        if (code instanceof Code.Zip zip && !zip.hasBucket() && config.getAssetBucket() != null) {
            return zip.withBucket(config.getAssetBucket());
        }
        return code;
    }

    private void validate(Code resolvedCode) {
        List<String> violations = new ArrayList<>();
        if (resolvedCode instanceof Code.Zip zip && !zip.hasBucket()) {
            violations.add("zip code requires a bucket, either on the code or as the configured asset bucket");
        }
        if (functionName != null && !FUNCTION_NAME.matcher(functionName).matches()) {
            violations.add("function name must be 1 to 64 letters, digits, hyphens or underscores");
        }
        environment.forEach((key, value) -> {
            if (key == null || !ENV_KEY.matcher(key).matches()) {
                violations.add("invalid environment variable name: " + key);
            }
            if (value == null) {
                violations.add("environment variable " + key + " has no value");
            }
        });
        if (role != null && !rolePolicies.isEmpty()) {
            violations.add("role policies can only be added to a generated role");
        }
        if (logGroup != null && generatedLogGroupRetention != null) {
            violations.add("either pass a log group or generate one, not both");
        }
        for (SqsEventSource source : sqsEventSources) {
            if (source.queue == null) {
                violations.add("sqs event source requires a queue");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    private Role generateRole() {
        RoleProperties.RolePropertiesBuilder properties = RoleProperties.builder()
                .assumeRolePolicyDocument(PolicyDocument.assumeRoleFor(LAMBDA_SERVICE))
                .managedPolicyArn(IntrinsicFunctions.join("", List.of(
                        "arn:",
                        IntrinsicFunctions.pseudoParameter(IntrinsicFunctions.AWS_PARTITION),
                        ":iam::aws:policy/service-role/AWSLambdaBasicExecutionRole")))
                .policies(rolePolicies);

        if (!sqsEventSources.isEmpty()) {
            Statement.StatementBuilder consume = Statement.builder()
                    .effect(Effect.ALLOW)
                    .action("sqs:ReceiveMessage")
                    .action("sqs:DeleteMessage")
                    .action("sqs:GetQueueAttributes");
            sqsEventSources.forEach(source -> consume.resource(source.queue.arn()));
            properties.policy(new Policy("ConsumeEventSources", PolicyDocument.of(consume.build())));
        }

        return RoleBuilder.create(resourceId.withSuffix("Role"), properties.build())
                .kind(GENERATED_ROLE_KIND)
                .idGenerator(idGenerator)
                .build();
    }

    private LogGroup generateLogGroup() {
        LogGroupBuilder builder = LogGroupBuilder.create(resourceId.withSuffix("LogGroup"))
                .retentionInDays(generatedLogGroupRetention)
                .idGenerator(idGenerator);
        if (functionName != null) {
            builder.logGroupName(LOG_GROUP_PREFIX + functionName);
        }
        return builder.build();
    }

    private static final class SqsEventSource {

        private final Queue queue;
        private final Integer maximumConcurrency;

        private SqsEventSource(Queue queue, Integer maximumConcurrency) {
            this.queue = queue;
            this.maximumConcurrency = maximumConcurrency;
        }
    }
}
