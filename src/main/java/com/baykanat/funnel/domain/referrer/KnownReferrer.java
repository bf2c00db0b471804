package com.baykanat.funnel.domain.referrer;

import lombok.Value;

/** Bilinen referrer kaynağı: görünen ad ve tür (search, social, email ...). */
@Value
public class KnownReferrer {

    String name;
    String type;
}
