package com.datacron.core.util;

import com.datacron.core.model.ReturnT;

import java.net.HttpURLConnection;
import java.net.URL;

/**
 * <h1>Outbound HTTP calls of the trigger path</h1>
 */
public class JobRemotingUtil {

    /**
     * <h2>Sends one GET request and classifies the answer</h2>
     *
     * Only the status code is looked at: a 2xx answer gives {@link ReturnT#SUCCESS_CODE},
     * anything else (other statuses, transport errors, timeouts) gives
     * {@link ReturnT#FAIL_CODE} with a readable message. Never throws.
     *
     * @param timeout connect and read timeout, in seconds; the response body is not read
     */
    public static ReturnT<String> get(String url, int timeout) {
        HttpURLConnection connection = null;
        try {
            URL realUrl = new URL(url);
            connection = (HttpURLConnection) realUrl.openConnection();
            connection.setRequestMethod("GET");
            connection.setUseCaches(false);
            connection.setConnectTimeout(timeout * 1000);
            connection.setReadTimeout(timeout * 1000);
            connection.connect();

            // the body is never read, disconnect() below drops the connection
            int statusCode = connection.getResponseCode();

            if (statusCode >= 200 && statusCode < 300) {
                return new ReturnT<>(ReturnT.SUCCESS_CODE, null);
            }
            String reason = connection.getResponseMessage();
            return new ReturnT<>(ReturnT.FAIL_CODE, "HTTP Status: " + statusCode + (reason != null ? " " + reason : ""));
        } catch (Exception e) {
            return new ReturnT<>(ReturnT.FAIL_CODE, "GET " + url + " failed: " + e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }
}
