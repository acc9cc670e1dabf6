package com.mk.fx.qa.fanout.execution.report;

import com.mk.fx.qa.fanout.execution.substrate.CheapTaskSubstrate;
import java.net.InetAddress;
import java.net.UnknownHostException;

/** Facts about the runtime a run executes on. */
public final class EnvironmentInfo {

  private static final long MB = 1024L * 1024L;

  private EnvironmentInfo() {
    // Prevent instantiation
  }

  /**
   * Retrieves the host name of the machine where the application is running.
   *
   * @return the host name, or {@code "unknown"} if it cannot be determined.
   */
  public static String host() {
    String env = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"), null);
    if (env != null) {
      return env;
    }

    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }

  /**
   * Retrieves the user who triggered the execution, from {@code TRIGGERED_BY} or the system user.
   *
   * @return the user name, or {@code "unknown"} if it cannot be determined.
   */
  public static String triggeredBy() {
    return firstNonBlank(
        System.getenv("TRIGGERED_BY"), System.getProperty("user.name"), "unknown");
  }

  public static String javaVersion() {
    return System.getProperty("java.version");
  }

  public static String javaVendor() {
    return System.getProperty("java.vendor");
  }

  public static String vmName() {
    return System.getProperty("java.vm.name");
  }

  public static int processors() {
    return Runtime.getRuntime().availableProcessors();
  }

  public static long maxMemoryMb() {
    return Runtime.getRuntime().maxMemory() / MB;
  }

  public static long totalMemoryMb() {
    return Runtime.getRuntime().totalMemory() / MB;
  }

  public static long freeMemoryMb() {
    return Runtime.getRuntime().freeMemory() / MB;
  }

  public static boolean cheapTasksAvailable() {
    return CheapTaskSubstrate.isVirtualThreadSupportAvailable();
  }

  private static String firstNonBlank(String a, String b, String def) {
    if (a != null && !a.isBlank()) {
      return a;
    }
    if (b != null && !b.isBlank()) {
      return b;
    }
    return def;
  }
}
