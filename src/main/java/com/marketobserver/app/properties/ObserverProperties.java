package com.marketobserver.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "observer")
public class ObserverProperties {
    private String zone = "Asia/Tokyo";
    private String outputsDir = "outputs";
    private History history = new History();
    private Keywords keywords = new Keywords();

    @Getter
    @Setter
    public static class History {
        private String path = "data/logs/history.json";
    }

    @Getter
    @Setter
    public static class Keywords {
        private String path = "";
    }
}
