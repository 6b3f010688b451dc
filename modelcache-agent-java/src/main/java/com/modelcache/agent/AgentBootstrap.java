package com.modelcache.agent;

import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the application JVM via:
 *   java -javaagent:modelcache-agent-java.jar=config=/etc/app/modelcache.json,namespace=com.shop -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   config     : JSON config file holding dev/aoe_modelcache/* (default: none, logging inactive)
 *   log_dir    : directory the report file is written to (default: ./var/log)
 *   base_dir   : prefix stripped from reported locations (default: working directory)
 *   source_root: prefix prepended to frame source paths (default: none)
 *   namespace  : class name prefix to instrument, e.g. "com.shop" (default: "com.")
 *   load_method: name of the entity load method (default: "load")
 *   profiler   : "true"/"false", overrides MODELCACHE_PROFILER (default: environment)
 *
 * Request scopes are opened by {@link ModelLoadTrackingFilter}.
 */
public class AgentBootstrap {

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        AgentConfig config = parseArgs(agentArgs);
        System.err.println("[modelcache] attaching to namespace: " + config.namespace()
            + " load_method=" + config.loadMethod());
        System.err.println("[modelcache] config: " + config.configPath() + " log_dir: " + config.logDir());

        ModelLoadTracker.install(settings(config));

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[modelcache] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            // Entity classes in the target namespace; never the agent itself or generated proxies
            .type(
                nameStartsWith(config.namespace())
                    .and(not(nameStartsWith("com.modelcache.agent")))
                    .and(not(nameContains("$$EnhancerBySpring")))
                    .and(not(nameContains("$Proxy")))
                    .and(not(nameContains("CGLIB")))
                    .and(not(nameContains("$$Lambda")))
            )
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(Advice.to(LoadAdvice.class).on(
                    isMethod()
                        .and(named(config.loadMethod()))
                        .and(not(isAbstract()))
                        .and(not(isNative()))
                        .and(not(isSynthetic()))
                        .and(not(takesArguments(0)))
                ))
            )
            .installOn(instrumentation);

        System.err.println("[modelcache] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    static TrackerSettings settings(AgentConfig config) {
        ConfigReader reader;
        if (config.configPath() == null) {
            reader = ConfigReader.empty();
        } else {
            try {
                reader = new JsonConfigReader(Paths.get(config.configPath()));
            } catch (JsonConfigReader.ConfigReadException e) {
                System.err.println("[modelcache] ERROR " + e.getMessage() + "; model load logging stays inactive");
                reader = ConfigReader.empty();
            }
        }
        DiagnosticsGate gate = config.profiler() != null
            ? DiagnosticsGate.of(config.profiler())
            : DiagnosticsGate.fromEnvironment();
        return new TrackerSettings(
            reader,
            new FileLogSink(Paths.get(config.logDir())),
            gate,
            config.baseDir(),
            config.sourceRoot() != null ? Path.of(config.sourceRoot()) : null
        );
    }

    static AgentConfig parseArgs(String agentArgs) {
        String workingDir = System.getProperty("user.dir");
        String configPath = null;
        String logDir = Paths.get(workingDir, "var", "log").toString();
        String baseDir = workingDir;
        String sourceRoot = null;
        String namespace = "com.";
        String loadMethod = "load";
        Boolean profiler = null;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2 && !kv[1].isBlank()) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "config"      -> configPath = value;
                        case "log_dir"     -> logDir     = value;
                        case "base_dir"    -> baseDir    = value;
                        case "source_root" -> sourceRoot = value;
                        case "namespace"   -> namespace  = value;
                        case "load_method" -> loadMethod = value;
                        case "profiler"    -> profiler   = ConfigReader.isTrue(value);
                        default -> System.err.println("[modelcache] ignoring unknown agent arg: " + kv[0].trim());
                    }
                }
            }
        }
        return new AgentConfig(configPath, logDir, baseDir, sourceRoot, namespace, loadMethod, profiler);
    }

    record AgentConfig(
        String configPath,
        String logDir,
        String baseDir,
        String sourceRoot,
        String namespace,
        String loadMethod,
        Boolean profiler
    ) {}
}
