package io.chimera.core.provider;

/**
 * Why a provider call produced an error envelope. Unknown providers are not listed: they are
 * served by the echo adapter and never reported as errors.
 */
public enum ProviderErrorKind {
    MISSING_CREDENTIAL,
    UNSUPPORTED_CAPABILITY,
    AUTHENTICATION_REJECTED,
    RATE_LIMIT_EXCEEDED,
    CONTENT_BLOCKED,
    GENERIC_PROVIDER_FAILURE
}
