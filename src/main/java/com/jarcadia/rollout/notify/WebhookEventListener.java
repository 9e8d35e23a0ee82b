package com.jarcadia.rollout.notify;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarcadia.rollout.exception.RolloutException;

/**
 * Posts each event as a JSON document to an HTTP endpoint, such as a chat webhook.
 */
public class WebhookEventListener implements DeployEventListener, Closeable {

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String url;

    public WebhookEventListener(HttpClient client, ObjectMapper mapper, String url) {
        this.client = client;
        this.mapper = mapper;
        this.url = url;
    }

    public static WebhookEventListener create(ObjectMapper mapper, String url, int timeoutMillis) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis).build();
        HttpClient client = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();
        return new WebhookEventListener(client, mapper, url);
    }

    @Override
    public void onEvent(DeployEvent event) {
        try {
            HttpPost post = new HttpPost(url);
            post.setEntity(new StringEntity(mapper.writeValueAsString(event), ContentType.APPLICATION_JSON.withCharset(StandardCharsets.UTF_8)));
            HttpResponse response = client.execute(post);
            int statusCode = response.getStatusLine().getStatusCode();
            EntityUtils.consumeQuietly(response.getEntity());
            if (statusCode >= 300) {
                throw new RolloutException("Webhook " + url + " responded with " + statusCode + " to " + event.getType());
            }
        } catch (IOException ex) {
            throw new RolloutException("Unable to post " + event.getType() + " to webhook " + url, ex);
        }
    }

    @Override
    public void close() throws IOException {
        if (client instanceof Closeable) {
            ((Closeable) client).close();
        }
    }
}
