package com.fhirsls.api.config;

import com.fhirsls.core.rules.RuleCompiler;
import com.fhirsls.core.scan.CodeScanner;
import com.fhirsls.core.tagging.TaggingOptions;
import com.fhirsls.core.tagging.UnsupportedRecordPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Engine options bound from {@code fhirsls.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "fhirsls")
@Validated
public class SlsProperties {

    @NotEmpty
    private List<String> supportedResourceTypes = List.copyOf(TaggingOptions.DEFAULT_SUPPORTED_TYPES);
    @NotNull
    private UnsupportedRecordPolicy unsupportedPolicy = UnsupportedRecordPolicy.PASS_THROUGH;
    @Min(1)
    private int maxScanDepth = CodeScanner.DEFAULT_MAX_DEPTH;
    @Min(1)
    private int maxMemberDepth = RuleCompiler.DEFAULT_MAX_MEMBER_DEPTH;
    private boolean parallel = false;

    public List<String> getSupportedResourceTypes() { return supportedResourceTypes; }
    public void setSupportedResourceTypes(List<String> types) { this.supportedResourceTypes = types; }
    public UnsupportedRecordPolicy getUnsupportedPolicy() { return unsupportedPolicy; }
    public void setUnsupportedPolicy(UnsupportedRecordPolicy policy) { this.unsupportedPolicy = policy; }
    public int getMaxScanDepth() { return maxScanDepth; }
    public void setMaxScanDepth(int maxScanDepth) { this.maxScanDepth = maxScanDepth; }
    public int getMaxMemberDepth() { return maxMemberDepth; }
    public void setMaxMemberDepth(int maxMemberDepth) { this.maxMemberDepth = maxMemberDepth; }
    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    public TaggingOptions toTaggingOptions() {
        return new TaggingOptions(new LinkedHashSet<>(supportedResourceTypes), unsupportedPolicy, maxScanDepth, parallel);
    }
}
