package net.certrevoke.client.category;

public class TestTags {
  private TestTags() {}

  public static final String CORE = "core";
  public static final String LOG = "log";
  public static final String TRANSPORT = "transport";
}
