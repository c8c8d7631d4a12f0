package uk.gegc.contentunlock.features.provider.application;

/**
 * One attempt at an upstream call. {@code attempt} starts at 1.
 */
@FunctionalInterface
public interface ProviderCall<T> {
    T call(int attempt) throws Exception;
}
