package com.infrakit.synth.resource.lambda;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;

/**
 * Starting state of a Lambda function. The code must be chosen first, then the handler
 * and the runtime; only after that are the optional settings and {@code build()}
 * available.
 *
 * <pre>
 * FunctionResources api = FunctionBuilder.create("api", Architecture.ARM64, 512, 30)
 *         .code(Code.zip("deploy-bucket", Path.of("target/api.zip")))
 *         .handler("index.handler")
 *         .runtime(Runtime.NODEJS_22)
 *         .environmentVariable("TABLE", table.ref())
 *         .build();
 * </pre>
 */
public class FunctionBuilder {

    private final ResourceId resourceId;
    private final Architecture architecture;
    private final int memory;
    private final int timeout;
    private IdGenerator idGenerator = IdGenerator.shared();

    private FunctionBuilder(ResourceId resourceId, Architecture architecture, int memory, int timeout) {
        this.resourceId = resourceId;
        this.architecture = architecture;
        this.memory = memory;
        this.timeout = timeout;
    }

    /**
     * @param memory  memory size in MB
     * @param timeout timeout in seconds
     */
    public static FunctionBuilder create(String id, Architecture architecture, int memory, int timeout) {
        if (architecture == null) {
            throw new ConfigurationException("function requires an architecture");
        }
        return new FunctionBuilder(ResourceId.of(id), architecture, memory, timeout);
    }

    public FunctionBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public WithCode code(Code code) {
        if (code == null) {
            throw new ConfigurationException("function code must not be null");
        }
        return new WithCode(this, code);
    }

    public static final class WithCode {

        private final FunctionBuilder start;
        private final Code code;

        private WithCode(FunctionBuilder start, Code code) {
            this.start = start;
            this.code = code;
        }

        public WithHandler handler(String handler) {
            if (handler == null || handler.isBlank()) {
                throw new ConfigurationException("function handler must not be blank");
            }
            return new WithHandler(this, handler);
        }
    }

    public static final class WithHandler {

        private final WithCode withCode;
        private final String handler;

        private WithHandler(WithCode withCode, String handler) {
            this.withCode = withCode;
            this.handler = handler;
        }

        public ConfiguredFunctionBuilder runtime(Runtime runtime) {
            if (runtime == null) {
                throw new ConfigurationException("function runtime must not be null");
            }
            FunctionBuilder start = withCode.start;
            return new ConfiguredFunctionBuilder(start.resourceId, start.idGenerator, start.architecture,
                    start.memory, start.timeout, withCode.code, handler, runtime);
        }
    }
}
