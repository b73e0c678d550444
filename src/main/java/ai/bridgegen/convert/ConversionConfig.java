package ai.bridgegen.convert;

import java.util.List;

import ai.bridgegen.model.QualifiedName;

/**
 * Settings for a conversion run.
 *
 * @param includeList headers every bridge block includes, in order
 * @param podRequests types the caller wants passed by value
 * @param oldRust     legacy toolchain mode: no native type declarations in front of bridge types
 */
public record ConversionConfig(
        List<String> includeList,
        List<QualifiedName> podRequests,
        boolean oldRust
) {
    public ConversionConfig {
        includeList = includeList != null ? List.copyOf(includeList) : List.of();
        podRequests = podRequests != null ? List.copyOf(podRequests) : List.of();
    }
}
