package io.parley.core.engine;

import java.util.List;

@FunctionalInterface
public interface FallbackActionDetector {
    List<SuggestedAction> detectFallbackActions(String text);
}
