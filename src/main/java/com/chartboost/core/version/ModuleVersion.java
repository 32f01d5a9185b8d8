package com.chartboost.core.version;

import com.chartboost.core.json.JacksonMapper;
import com.chartboost.core.log.Logger;
import com.chartboost.core.log.LoggerFactory;
import com.chartboost.core.util.ResourceUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version of a module as recorded in its bundled version file.
 */
@Value
public class ModuleVersion {

    private static final Logger logger = LoggerFactory.getLogger(ModuleVersion.class);

    public static final String UNDEFINED = "undefined";

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+(\\.\\d+)+");

    String version;

    private ModuleVersion(String version) {
        this.version = version;
    }

    public static ModuleVersion create(String versionFilePath, JacksonMapper jacksonMapper) {
        final VersionFile versionFile;
        try {
            versionFile = jacksonMapper.decodeValue(ResourceUtil.readFromClasspath(versionFilePath), VersionFile.class);
        } catch (IOException | RuntimeException e) {
            logger.error("Was not able to read version file {}. Reason: {}", versionFilePath, e.getMessage());
            return new ModuleVersion(UNDEFINED);
        }

        final String version = versionFile.getVersion();
        return new ModuleVersion(version != null ? extractVersion(version) : UNDEFINED);
    }

    private static String extractVersion(String rawVersion) {
        final Matcher versionMatcher = VERSION_PATTERN.matcher(rawVersion);
        return versionMatcher.lookingAt() ? versionMatcher.group() : UNDEFINED;
    }

    @Value
    @NoArgsConstructor(force = true)
    @AllArgsConstructor(staticName = "of")
    private static class VersionFile {

        @JsonProperty("module.version")
        String version;
    }
}
