package io.gatesync.core.token;

import io.gatesync.core.upstream.UpstreamToken;
import java.util.List;

/**
 * Upstream credential lifecycle. Listing covers every page.
 */
public interface TokenStore {

    List<UpstreamToken> listTokens();

    void createToken(String name, String group);

    void deleteToken(long id);
}
