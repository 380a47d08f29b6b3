package org.snowlite.engine.template;

import org.snowlite.engine.project.ProjectConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Everything a compile reads besides the registry: variables, target fields,
 * the invocation's fixed timestamp and id, and the process environment.
 *
 * {@code run_started_at} and {@code invocation_id} are fixed when the context is
 * created, so compiling the same SQL twice with one context gives identical output.
 *
 * @param incrementalRun False when the current build recreates incremental models from
 *                       scratch (first build or full refresh); {@code is_incremental()}
 *                       is then false even for incremental models
 */
public record TemplateContext(
        Map<String, Object> vars,
        TargetConfig target,
        Instant runStartedAt,
        String invocationId,
        Function<String, String> environment,
        boolean incrementalRun) {

    public TemplateContext {
        vars = vars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(runStartedAt, "Run start time cannot be null");
        invocationId = invocationId == null ? md5Hex(runStartedAt.toString()) : invocationId;
        environment = environment == null ? System::getenv : environment;
    }

    public static TemplateContext of(ProjectConfig config) {
        return of(config, Clock.systemUTC(), System::getenv);
    }

    public static TemplateContext of(ProjectConfig config, Clock clock, Function<String, String> environment) {
        return new TemplateContext(config.vars(), TargetConfig.from(config), clock.instant(), null,
                environment, true);
    }

    public TemplateContext withVars(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(vars);
        merged.putAll(overrides);
        return new TemplateContext(merged, target, runStartedAt, invocationId, environment, incrementalRun);
    }

    public TemplateContext withIncrementalRun(boolean incremental) {
        return new TemplateContext(vars, target, runStartedAt, invocationId, environment, incremental);
    }

    static String md5Hex(String text) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
