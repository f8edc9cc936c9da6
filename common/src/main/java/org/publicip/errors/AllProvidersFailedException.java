package org.publicip.errors;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every provider of a fallback list has failed. The failures are kept in the order the providers
 * were tried.
 */
public class AllProvidersFailedException extends PublicIpException {
    private final List<LookupException> _failures;

    public AllProvidersFailedException(@NotNull List<LookupException> failures) {
        super(describe(failures));
        _failures = List.copyOf(failures);
        _failures.forEach(this::addSuppressed);
    }

    public @NotNull List<LookupException> getFailures() {
        return _failures;
    }

    private static String describe(List<LookupException> failures) {
        return "All providers failed: " + failures.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; ", "[", "]"));
    }
}
