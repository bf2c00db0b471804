package com.baykanat.funnel.domain.referrer;

import java.util.Optional;

/** Normalize edilmiş host için bilinen referrer araması; testlerde değiştirilebilir. */
public interface ReferrerLookup {

    Optional<KnownReferrer> find(String host);
}
