package com.delangzeta.realtime.sync;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Max documents returned per collection per pull. Default 100. */
    private int pageSize = 100;
}
