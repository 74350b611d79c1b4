package telemetry.privacy;

import telemetry.util.Hashes;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes or anonymizes sensitive substrings before text leaves the process.
 *
 * <p>{@link #scrubMessage(String)} is the transform applied to every event message and string
 * context value. It runs, in order: URL anonymization, email, UUID, standalone IP, GPS
 * coordinate and API token scrubbing. The result is deterministic (the same URL always maps to
 * the same {@code url-<hex>} token, so the backend can still group recurring errors), idempotent,
 * and never contains the original host, user info or IP octets of a URL or standalone address.
 *
 * <p>The remaining methods are narrower helpers for callers that know what kind of value they
 * hold, e.g. a credential-bearing notification URL or a file path.
 *
 * <p>All methods are pure and thread-safe.
 */
public final class PrivacyScrubber {
  public static final String REDACTED = "[REDACTED]";
  public static final String EMPTY_USER = "[EMPTY_USER]";
  public static final String EMPTY_PASSWORD = "[EMPTY_PASSWORD]";
  public static final String EMPTY_TOKEN = "[EMPTY_TOKEN]";

  private static final int HASH_SHORT = 4;
  private static final int HASH_MEDIUM = 8;
  private static final int HASH_LONG = 12;

  private static final Pattern URL = Pattern.compile("\\b(?i:https?|rtsp|rtmp)://\\S+");
  private static final Pattern EMAIL =
      Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
  private static final Pattern UUID = Pattern.compile(
      "\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b");
  private static final Pattern IPV4 = Pattern.compile(
      "\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b");
  private static final Pattern IPV6 =
      Pattern.compile("(?<![\\w:.])(?:[0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}(?![\\w:]|\\.\\d)");
  // decimals are required so that plain "12, 34" lists survive
  private static final Pattern COORDINATES = Pattern.compile(
      "(?i)\\blat(?:itude)?\\s*[:=]?\\s*-?\\d{1,3}\\.\\d+\\s*[,;]?\\s*(?:lng|lon|longitude)\\s*[:=]?\\s*-?\\d{1,3}\\.\\d+"
          + "|(?<![\\w.-])-?\\d{1,3}\\.\\d+\\s*,\\s*-?\\d{1,3}\\.\\d+(?![\\d.])");
  private static final Pattern API_TOKEN = Pattern.compile(
      "(?i)(?:(?:api[_-]?key|token|secret|auth)[:=]\\s*|bearer(?:\\s+token)?[:=\\s]+"
          + "|with\\s+(?:token|key|secret|auth)\\s+)([A-Za-z0-9+/\\-_]{8,}[A-Za-z0-9+/=]*)");
  private static final Pattern TOKEN_VALUE = Pattern.compile("[A-Za-z0-9+/\\-_]{8,}[A-Za-z0-9+/=]*");
  private static final Pattern SEPARATOR = Pattern.compile("[:=]\\s*");

  private static final Pattern RTSP_URL = Pattern.compile(
      "rtsp://(?:[^:@/\\s]+:[^@/\\s]+@)?(?:\\[[0-9a-fA-F:]+]|[^/:\\s]+)(?::[0-9]+)?(?:/\\S*)?");
  private static final Pattern FFMPEG_PREFIX = Pattern.compile("\\[\\w+\\s*@\\s*0x[0-9a-fA-F]+]\\s*");
  private static final Pattern URL_CREDENTIALS = Pattern.compile("(://)[^:@/]+:[^@/]+@");
  private static final Pattern URL_USER = Pattern.compile("(://)[^:@/]+@");
  private static final Pattern BOT_TOKEN = Pattern.compile("/bot[A-Za-z0-9:_-]{20,}/");
  private static final Pattern WEBHOOK = Pattern.compile("/\\d{15,}/[A-Za-z0-9_-]{50,}");

  private static final Set<String> TWO_PART_TLDS = Set.of(
      "co.uk", "co.nz", "co.za", "co.jp",
      "gov.uk", "gov.au", "gov.ca",
      "ac.uk", "edu.au", "org.uk",
      "net.au", "com.au");
  private static final List<String> STREAM_KEYWORDS =
      List.of("stream", "live", "rtsp", "video", "audio", "feed", "cam", "camera");

  // more specific browsers first: Edge and Opera user agents also carry "Chrome/"
  private static final List<UserAgentPattern> USER_AGENTS = List.of(
      new UserAgentPattern("Edge", "Edg/[\\d.]+", true),
      new UserAgentPattern("Opera", "Opera/[\\d.]+|OPR/[\\d.]+", true),
      new UserAgentPattern("Chrome", "Chrome/[\\d.]+", true),
      new UserAgentPattern("Firefox", "Firefox/[\\d.]+", true),
      new UserAgentPattern("Safari", "Safari/[\\d.]+", true),
      new UserAgentPattern("Windows", "Windows NT [\\d.]+", false),
      new UserAgentPattern("Mac", "Mac OS X [\\d._]+", false),
      new UserAgentPattern("Android", "Android [\\d.]+", false),
      new UserAgentPattern("iOS", "iPhone OS [\\d._]+", false),
      new UserAgentPattern("Linux", "Linux", false));

  private PrivacyScrubber() {
  }

  /**
   * Scrubs a free-text message.
   *
   * @param text the message, may be {@code null}
   * @return the scrubbed message; {@code ""} for {@code null}
   */
  public static String scrubMessage(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String result = replace(URL, text, PrivacyScrubber::anonymizeUrl);
    result = scrubEmails(result);
    result = scrubUuids(result);
    result = scrubStandaloneIps(result);
    result = scrubCoordinates(result);
    return scrubApiTokens(result);
  }

  /**
   * Replaces a URL with a stable token that keeps only its scheme, host class, port and path
   * shape.
   *
   * <p>The normalized form {@code scheme:host-class[:port-N][:path-structure]} is hashed with
   * SHA-256 and truncated to 12 bytes, giving {@code url-<24 hex>}. A URL that cannot be parsed
   * becomes {@code url-hash-<16 hex>} of the raw string.
   */
  public static String anonymizeUrl(String rawUrl) {
    URI uri;
    try {
      uri = new URI(rawUrl);
    } catch (URISyntaxException e) {
      return "url-hash-" + Hashes.sha256Hex(rawUrl, HASH_MEDIUM);
    }

    List<String> parts = new ArrayList<>(4);
    if (uri.getScheme() != null) {
      parts.add(uri.getScheme().toLowerCase(Locale.ROOT));
    }
    HostPort hostPort = HostPort.of(uri);
    if (!hostPort.host().isEmpty()) {
      parts.add(categorizeHost(hostPort.host()));
    }
    if (!hostPort.port().isEmpty()) {
      parts.add("port-" + hostPort.port());
    }
    String path = uri.getPath();
    if (path != null && !path.isEmpty() && !path.equals("/")) {
      parts.add(anonymizeUrlPath(path));
    }
    return "url-" + Hashes.sha256Hex(String.join(":", parts), HASH_LONG);
  }

  public static String scrubEmails(String text) {
    return EMAIL.matcher(text).replaceAll("[EMAIL]");
  }

  public static String scrubUuids(String text) {
    return UUID.matcher(text).replaceAll("[UUID]");
  }

  /**
   * Anonymizes IPv4 and IPv6 addresses that are not part of a URL. Candidates that are not valid
   * IP literals, such as clock times, are left unchanged.
   */
  public static String scrubStandaloneIps(String text) {
    List<int[]> urls = new ArrayList<>();
    Matcher url = URL.matcher(text);
    while (url.find()) {
      urls.add(new int[] {url.start(), url.end()});
    }

    List<int[]> candidates = new ArrayList<>();
    collect(IPV4.matcher(text), candidates);
    collect(IPV6.matcher(text), candidates);
    if (candidates.isEmpty()) {
      return text;
    }
    candidates.sort(Comparator.<int[]>comparingInt(c -> c[0]).thenComparingInt(c -> -c[1]));

    StringBuilder out = new StringBuilder(text.length());
    int last = 0;
    for (int[] candidate : candidates) {
      if (candidate[0] < last || within(urls, candidate)) {
        continue;
      }
      Optional<InetAddress> address = IpAddresses.parse(text.substring(candidate[0], candidate[1]));
      if (address.isEmpty()) {
        continue;
      }
      out.append(text, last, candidate[0]).append(anonymizeIp(address.get()));
      last = candidate[1];
    }
    return out.append(text, last, text.length()).toString();
  }

  public static String scrubCoordinates(String text) {
    return COORDINATES.matcher(text).replaceAll("[LAT],[LON]");
  }

  /**
   * Replaces API keys, secrets, and bearer tokens with {@code [TOKEN]}, keeping the key name.
   */
  public static String scrubApiTokens(String text) {
    return replace(API_TOKEN, text, match -> {
      String lower = match.toLowerCase(Locale.ROOT);
      if (lower.contains("bearer")) {
        return "Bearer [TOKEN]";
      }
      if (lower.startsWith("with")) {
        String[] words = match.trim().split("\\s+");
        return words[0] + " " + words[1] + " [TOKEN]";
      }
      String result = TOKEN_VALUE.matcher(match).replaceAll("[TOKEN]");
      return SEPARATOR.matcher(result).replaceAll(": ");
    });
  }

  /**
   * Anonymizes an IP literal as {@code <class>-<16 hex>}, where the class is {@code localhost},
   * {@code private-ip} or {@code public-ip}. Text that is not an IP literal becomes
   * {@code invalid-ip-<16 hex>}.
   */
  public static String anonymizeIp(String ip) {
    if (ip == null || ip.isEmpty()) {
      return "";
    }
    return IpAddresses.parse(ip)
        .map(PrivacyScrubber::anonymizeIp)
        .orElseGet(() -> "invalid-ip-" + Hashes.sha256Hex(ip, HASH_MEDIUM));
  }

  private static String anonymizeIp(InetAddress address) {
    return IpAddresses.classify(address) + "-" + Hashes.sha256Hex(address.getHostAddress(), HASH_MEDIUM);
  }

  /**
   * Returns whether {@code host} is an RFC 1918, loopback, link-local, IPv6 unique-local or IPv6
   * multicast address.
   */
  public static boolean isPrivateIp(String host) {
    return IpAddresses.isPrivate(host);
  }

  /**
   * Redacts the user info of a URL and bot or webhook tokens in its path. Suited to
   * notification-service URLs such as {@code telegram://token@telegram}.
   */
  public static String scrubCredentialUrl(String rawUrl) {
    if (rawUrl == null || rawUrl.isEmpty()) {
      return "";
    }
    String result;
    try {
      URI uri = new URI(rawUrl);
      String authority = uri.getRawAuthority();
      result = authority != null && authority.indexOf('@') >= 0
          ? replaceUserInfo(rawUrl, REDACTED + "@")
          : rawUrl;
    } catch (URISyntaxException e) {
      result = URL_CREDENTIALS.matcher(rawUrl).replaceAll("$1" + Matcher.quoteReplacement(REDACTED) + "@");
      result = URL_USER.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(REDACTED) + "@");
    }
    result = BOT_TOKEN.matcher(result).replaceAll("/bot[TOKEN]/");
    return WEBHOOK.matcher(result).replaceAll("/[WEBHOOK_ID]/[TOKEN]");
  }

  /**
   * Strips credentials from an RTSP URL, keeping host, port and path for debugging. Anything
   * that is not a parseable RTSP URL is returned unchanged.
   */
  public static String sanitizeRtspUrl(String source) {
    URI uri;
    try {
      uri = new URI(source);
    } catch (URISyntaxException e) {
      return source;
    }
    if (!"rtsp".equalsIgnoreCase(uri.getScheme())) {
      return source;
    }
    String authority = uri.getRawAuthority();
    if (authority == null || authority.indexOf('@') < 0) {
      return source;
    }
    return replaceUserInfo(source, "");
  }

  /**
   * Applies {@link #sanitizeRtspUrl(String)} to every RTSP URL in {@code text}.
   */
  public static String sanitizeRtspUrls(String text) {
    return replace(RTSP_URL, text, PrivacyScrubber::sanitizeRtspUrl);
  }

  /**
   * Removes FFmpeg context prefixes such as {@code [rtsp @ 0x55d4a4808980]}, whose addresses
   * differ per process and defeat deduplication, then strips RTSP credentials.
   */
  public static String sanitizeFfmpegError(String text) {
    return sanitizeRtspUrls(FFMPEG_PREFIX.matcher(text).replaceAll(""));
  }

  /**
   * Anonymizes a Unix or Windows file path segment by segment. The hierarchy, the leading
   * separator and the extension of the last segment are kept.
   */
  public static String anonymizePath(String path) {
    if (path == null || path.isEmpty()) {
      return "";
    }
    boolean absolute = path.startsWith("/") || (path.length() >= 2 && path.charAt(1) == ':');
    String separator = path.contains("\\") ? "\\" : "/";

    List<String> segments = new ArrayList<>();
    for (String segment : path.split("[/\\\\]")) {
      if (!segment.isEmpty()) {
        segments.add(segment);
      }
    }
    if (segments.isEmpty()) {
      return "empty-path";
    }

    List<String> anonymized = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      String segment = segments.get(i);
      String extension = "";
      if (i == segments.size() - 1) {
        int dot = segment.lastIndexOf('.');
        if (dot > 0) {
          extension = segment.substring(dot);
          segment = segment.substring(0, dot);
        }
      }
      anonymized.add("path-" + Hashes.sha256Hex(segment, HASH_SHORT) + extension);
    }

    String result = String.join(separator, anonymized);
    return absolute ? separator + result : result;
  }

  /**
   * Reduces a user agent to its browser and OS family, e.g. {@code "Chrome Windows"}, or
   * {@code "Bot ..."} for crawlers. Unrecognized agents become {@code ua-<16 hex>}.
   */
  public static String redactUserAgent(String userAgent) {
    if (userAgent == null || userAgent.isEmpty()) {
      return "";
    }
    String lower = userAgent.toLowerCase(Locale.ROOT);
    boolean bot = lower.contains("bot") || lower.contains("crawler") || lower.contains("spider");

    List<String> components = new ArrayList<>(3);
    boolean foundBrowser = bot;
    boolean foundOs = false;
    if (bot) {
      components.add("Bot");
    }
    for (UserAgentPattern candidate : USER_AGENTS) {
      if (!candidate.pattern().matcher(userAgent).find()) {
        continue;
      }
      if (candidate.browser() && !foundBrowser) {
        components.add(candidate.name());
        foundBrowser = true;
      } else if (!candidate.browser() && !foundOs) {
        components.add(candidate.name());
        foundOs = true;
      }
      if (foundBrowser && foundOs) {
        break;
      }
    }

    if (components.isEmpty()) {
      return "ua-" + Hashes.sha256Hex(userAgent, HASH_MEDIUM);
    }
    return String.join(" ", components);
  }

  /**
   * Returns {@code user-<8 hex>}, stable per username so log lines can still be correlated.
   */
  public static String scrubUsername(String username) {
    if (username == null || username.isEmpty()) {
      return EMPTY_USER;
    }
    return "user-" + Hashes.sha256Hex(username, HASH_SHORT);
  }

  public static String scrubPassword(String password) {
    if (password == null || password.isEmpty()) {
      return EMPTY_PASSWORD;
    }
    return REDACTED;
  }

  /**
   * Returns {@code [TOKEN:len=N]} where N is the token length in characters.
   */
  public static String scrubToken(String token) {
    if (token == null || token.isEmpty()) {
      return EMPTY_TOKEN;
    }
    return "[TOKEN:len=" + token.length() + "]";
  }

  static String categorizeHost(String host) {
    return IpAddresses.classify(host).orElseGet(() -> categorizeDomain(host));
  }

  static String categorizeDomain(String host) {
    String[] parts = host.toLowerCase(Locale.ROOT).split("\\.");
    if (parts.length < 2) {
      return "unknown-host";
    }
    if (parts.length >= 3) {
      String twoPart = parts[parts.length - 2] + "." + parts[parts.length - 1];
      if (TWO_PART_TLDS.contains(twoPart)) {
        return "domain-" + twoPart;
      }
    }
    return "domain-" + parts[parts.length - 1];
  }

  static String anonymizeUrlPath(String path) {
    String trimmed = trimSlashes(path);
    if (trimmed.isEmpty()) {
      return "path-root";
    }
    List<String> out = new ArrayList<>();
    for (String segment : trimmed.split("/")) {
      if (segment.isEmpty()) {
        continue;
      }
      if (isStreamName(segment)) {
        out.add("path-stream");
      } else if (isNumeric(segment)) {
        out.add("path-numeric");
      } else {
        out.add("path-seg-" + Hashes.sha256Hex(segment, HASH_SHORT));
      }
    }
    return String.join("/", out);
  }

  private static boolean isStreamName(String segment) {
    String lower = segment.toLowerCase(Locale.ROOT);
    for (String keyword : STREAM_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isNumeric(String segment) {
    for (int i = 0; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return !segment.isEmpty();
  }

  private static String trimSlashes(String path) {
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end);
  }

  /**
   * Replaces everything between {@code ://} and the last {@code @} of the authority.
   */
  private static String replaceUserInfo(String url, String replacement) {
    int schemeEnd = url.indexOf("://");
    if (schemeEnd < 0) {
      return url;
    }
    int authorityStart = schemeEnd + 3;
    int authorityEnd = url.length();
    for (int i = authorityStart; i < url.length(); i++) {
      char c = url.charAt(i);
      if (c == '/' || c == '?' || c == '#') {
        authorityEnd = i;
        break;
      }
    }
    int at = url.lastIndexOf('@', authorityEnd - 1);
    if (at < authorityStart) {
      return url;
    }
    return url.substring(0, authorityStart) + replacement + url.substring(at + 1);
  }

  private static void collect(Matcher matcher, List<int[]> out) {
    while (matcher.find()) {
      out.add(new int[] {matcher.start(), matcher.end()});
    }
  }

  private static boolean within(List<int[]> ranges, int[] candidate) {
    for (int[] range : ranges) {
      if (candidate[0] >= range[0] && candidate[1] <= range[1]) {
        return true;
      }
    }
    return false;
  }

  private static String replace(Pattern pattern, String text, UnaryOperator<String> replacer) {
    return pattern.matcher(text).replaceAll(match -> Matcher.quoteReplacement(replacer.apply(match.group())));
  }

  private record UserAgentPattern(String name, Pattern pattern, boolean browser) {
    UserAgentPattern(String name, String regex, boolean browser) {
      this(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), browser);
    }
  }

  /**
   * Host and port of a URL. Falls back to the raw authority when {@link URI} cannot parse it as
   * a server authority, e.g. for host names with underscores or unescaped {@code @} in passwords.
   */
  private record HostPort(String host, String port) {
    static HostPort of(URI uri) {
      if (uri.getHost() != null) {
        String host = uri.getHost();
        if (host.startsWith("[") && host.endsWith("]")) {
          host = host.substring(1, host.length() - 1);
        }
        return new HostPort(host, uri.getPort() >= 0 ? Integer.toString(uri.getPort()) : "");
      }
      String authority = uri.getRawAuthority();
      if (authority == null) {
        return new HostPort("", "");
      }
      String hostPort = authority.substring(authority.lastIndexOf('@') + 1);
      if (hostPort.startsWith("[")) {
        int close = hostPort.indexOf(']');
        if (close > 0) {
          String rest = hostPort.substring(close + 1);
          String port = rest.startsWith(":") && isNumeric(rest.substring(1)) ? rest.substring(1) : "";
          return new HostPort(hostPort.substring(1, close), port);
        }
        return new HostPort(hostPort, "");
      }
      int colon = hostPort.lastIndexOf(':');
      if (colon >= 0 && isNumeric(hostPort.substring(colon + 1))) {
        return new HostPort(hostPort.substring(0, colon), hostPort.substring(colon + 1));
      }
      return new HostPort(hostPort, "");
    }
  }
}
