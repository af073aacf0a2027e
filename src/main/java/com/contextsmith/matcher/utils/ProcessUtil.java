package com.contextsmith.matcher.utils;

public class ProcessUtil {

  public static String getHeapConsumption() {
    long heapSize = Runtime.getRuntime().totalMemory() / 1024 / 1024;
    long freeSize = Runtime.getRuntime().freeMemory() / 1024 / 1024;
    long heapMaxSize = Runtime.getRuntime().maxMemory() / 1024 / 1024;
    return String.format("%d/%d/%d MB Used",
                         heapSize - freeSize, heapSize, heapMaxSize);
  }

  private ProcessUtil() {
  }
}
