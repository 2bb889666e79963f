package me.golemcore.observatory.infrastructure.http;

import me.golemcore.observatory.infrastructure.config.ObservatoryProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeoutsWithoutConnectionRetries() {
        ObservatoryProperties properties = new ObservatoryProperties();
        properties.getHttp().setConnectTimeout(2000);
        properties.getHttp().setReadTimeout(7000);
        properties.getHttp().setWriteTimeout(9000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(2000, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
        assertEquals(9000, client.writeTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }
}
