package com.datacron.core.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.List;

/**
 * Shared Gson instance: ISO-8601 dates, no HTML escaping, nulls omitted. Untyped numbers
 * (tenant data values) read back as {@code Long} when integral, so {@code 1} stays {@code 1}.
 */
public class GsonTool {

    public static final String DATE_FORMAT = "yyyy-MM-dd'T'HH:mm:ssXXX";

    private static final Gson gson = new GsonBuilder()
            .setDateFormat(DATE_FORMAT)
            .disableHtmlEscaping()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private static final Gson prettyGson = gson.newBuilder()
            .setPrettyPrinting()
            .create();

    public static Gson getGson() {
        return gson;
    }

    public static String toJson(Object src) {
        return gson.toJson(src);
    }

    /**
     * Indented output, used for the configuration file.
     */
    public static String toPrettyJson(Object src) {
        return prettyGson.toJson(src);
    }

    public static <T> T fromJson(String json, Class<T> classOfT) {
        return gson.fromJson(json, classOfT);
    }

    public static <T> T fromJson(String json, Type typeOfT) {
        return gson.fromJson(json, typeOfT);
    }

    public static <T> List<T> fromJsonList(String json, Class<T> classOfT) {
        return gson.fromJson(json, TypeToken.getParameterized(List.class, classOfT).getType());
    }
}
