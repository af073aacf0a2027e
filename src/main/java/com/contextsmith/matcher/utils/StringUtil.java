package com.contextsmith.matcher.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class StringUtil {
  private static Gson gson = null;

  public static synchronized Gson getGsonInstance() {
    if (gson == null) gson = makeGsonInstance();
    return gson;
  }

  public static String toJson(Object o) {
    return getGsonInstance().toJson(o);
  }

  private static Gson makeGsonInstance() {
    return new GsonBuilder().disableHtmlEscaping()
                            .setPrettyPrinting()
                            .create();
  }

  private StringUtil() {
  }
}
