package com.delangzeta.realtime.api;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.api")
@NoArgsConstructor
@Getter
@Setter
public class ApiProperties {

    /** Put exception messages into 500 bodies. Development only. Default false. */
    private boolean exposeErrorDetails;
}
