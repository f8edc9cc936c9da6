package org.publicip.lookup.providers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;
import org.publicip.errors.LookupException;
import org.publicip.lookup.Provider;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.net.InetAddress;

/**
 * A provider that always answers with its configured address, whatever the reply body.
 * <p>
 * Without an endpoint, the provider is offline and no request is made. With an endpoint, the request is made
 * and the reply status goes through the usual mapping, which lets tests simulate failing backends.
 */
public class MockProvider implements Provider {
    private final LookupProvider _identity;

    public MockProvider(@NotNull LookupProvider identity) {
        if (!identity.isMock()) {
            throw new IllegalArgumentException("Not a mock provider: " + identity);
        }
        _identity = identity;
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return _identity.endpoint() == null ? "" : _identity.endpoint();
    }

    @Override
    public @NotNull LookupResponse parse(@NotNull String body) throws LookupException {
        var address = Common.parseAddress(_identity.mockAddress());
        if (address == null) {
            throw LookupException.parse(_identity, "Invalid IP address: " + _identity.mockAddress(), null);
        }
        return LookupResponse.of(address, _identity);
    }

    @Override
    public @NotNull LookupProvider identity() {
        return _identity;
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    public boolean isOffline() {
        return _identity.endpoint() == null;
    }
}
