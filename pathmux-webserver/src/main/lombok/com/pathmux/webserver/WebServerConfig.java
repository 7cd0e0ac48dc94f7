package com.pathmux.webserver;

import com.pathmux.router.RoutePrecedence;
import java.io.File;
import lombok.Builder;
import lombok.Data;

@Data @Builder
public class WebServerConfig {
    public interface Factory {
        public WebServerConfig create(File file);
    }
    // null binds every interface:
    private String host;
    private Integer port;
    private RoutePrecedence routePrecedence;
}
