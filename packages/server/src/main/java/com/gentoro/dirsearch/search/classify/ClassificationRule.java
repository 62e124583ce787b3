package com.gentoro.dirsearch.search.classify;

import java.util.Optional;

/** One step of the classification chain. Returns empty when the rule has no opinion. */
@FunctionalInterface
public interface ClassificationRule {
  Optional<ClassificationVerdict> evaluate(ContentSample sample);
}
