package telemetry.privacy;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strict IP literal parsing and classification.
 *
 * <p>Literals are parsed by hand and turned into addresses with
 * {@link InetAddress#getByAddress(byte[])}, so no call here ever triggers a name lookup.
 * IPv4 octets with leading zeros and IPv6 zone identifiers are rejected.
 */
public final class IpAddresses {
  static final String LOCALHOST = "localhost";
  static final String PRIVATE_IP = "private-ip";
  static final String PUBLIC_IP = "public-ip";

  private IpAddresses() {
  }

  /**
   * Parses an IPv4 or IPv6 literal. Surrounding brackets are accepted for IPv6.
   *
   * @param literal the candidate text
   * @return the address, or empty if {@code literal} is not a valid IP literal
   */
  public static Optional<InetAddress> parse(String literal) {
    if (literal == null || literal.isEmpty()) {
      return Optional.empty();
    }
    String text = literal;
    if (text.startsWith("[") && text.endsWith("]") && text.length() > 2) {
      text = text.substring(1, text.length() - 1);
    }
    byte[] bytes = text.indexOf(':') >= 0 ? parseIpv6(text) : parseIpv4(text);
    if (bytes == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(InetAddress.getByAddress(bytes));
    } catch (UnknownHostException e) {
      throw new IllegalStateException("unexpected address length " + bytes.length, e);
    }
  }

  /**
   * Returns whether {@code host} is a private, loopback, link-local or IPv6 multicast address.
   * Host names always return {@code false}.
   */
  public static boolean isPrivate(String host) {
    return parse(host).map(IpAddresses::isPrivate).orElse(false);
  }

  static boolean isPrivate(InetAddress address) {
    byte[] b = address.getAddress();
    if (address instanceof Inet4Address) {
      int first = b[0] & 0xFF;
      int second = b[1] & 0xFF;
      return first == 10
          || (first == 172 && second >= 16 && second <= 31)
          || (first == 192 && second == 168)
          || first == 127
          || (first == 169 && second == 254);
    }
    int first = b[0] & 0xFF;
    return (first & 0xFE) == 0xFC
        || address.isLoopbackAddress()
        || (first == 0xFE && (b[1] & 0xC0) == 0x80)
        || first == 0xFF;
  }

  /**
   * Classifies a host as {@code localhost}, {@code private-ip} or {@code public-ip}.
   *
   * @return the class, or empty if {@code host} is neither {@code "localhost"} nor an IP literal
   */
  static Optional<String> classify(String host) {
    if (LOCALHOST.equalsIgnoreCase(host)) {
      return Optional.of(LOCALHOST);
    }
    return parse(host).map(IpAddresses::classify);
  }

  static String classify(InetAddress address) {
    if (isLocalhost(address)) {
      return LOCALHOST;
    }
    return isPrivate(address) ? PRIVATE_IP : PUBLIC_IP;
  }

  private static boolean isLocalhost(InetAddress address) {
    byte[] b = address.getAddress();
    if (address instanceof Inet4Address) {
      return b[0] == 127 && b[1] == 0 && b[2] == 0 && b[3] == 1;
    }
    return address.isLoopbackAddress();
  }

  static byte[] parseIpv4(String text) {
    String[] parts = text.split("\\.", -1);
    if (parts.length != 4) {
      return null;
    }
    byte[] out = new byte[4];
    for (int i = 0; i < 4; i++) {
      int value = parseOctet(parts[i]);
      if (value < 0) {
        return null;
      }
      out[i] = (byte) value;
    }
    return out;
  }

  private static int parseOctet(String part) {
    int len = part.length();
    if (len == 0 || len > 3 || (len > 1 && part.charAt(0) == '0')) {
      return -1;
    }
    int value = 0;
    for (int i = 0; i < len; i++) {
      char c = part.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      value = value * 10 + (c - '0');
    }
    return value <= 255 ? value : -1;
  }

  static byte[] parseIpv6(String text) {
    if (text.indexOf('%') >= 0) {
      return null;
    }
    int gap = text.indexOf("::");
    if (gap >= 0 && gap != text.lastIndexOf("::")) {
      return null;
    }
    List<Integer> head = new ArrayList<>(8);
    List<Integer> tail = new ArrayList<>(8);
    if (gap < 0) {
      if (!parseGroups(text, true, head) || head.size() != 8) {
        return null;
      }
    } else {
      if (!parseGroups(text.substring(0, gap), false, head)
          || !parseGroups(text.substring(gap + 2), true, tail)
          || head.size() + tail.size() > 7) {
        return null;
      }
    }
    byte[] out = new byte[16];
    for (int i = 0; i < head.size(); i++) {
      putGroup(out, i, head.get(i));
    }
    int offset = 8 - tail.size();
    for (int i = 0; i < tail.size(); i++) {
      putGroup(out, offset + i, tail.get(i));
    }
    return out;
  }

  private static boolean parseGroups(String part, boolean allowIpv4Tail, List<Integer> out) {
    if (part.isEmpty()) {
      return true;
    }
    String[] pieces = part.split(":", -1);
    for (int i = 0; i < pieces.length; i++) {
      String piece = pieces[i];
      if (allowIpv4Tail && i == pieces.length - 1 && piece.indexOf('.') >= 0) {
        byte[] v4 = parseIpv4(piece);
        if (v4 == null) {
          return false;
        }
        out.add(((v4[0] & 0xFF) << 8) | (v4[1] & 0xFF));
        out.add(((v4[2] & 0xFF) << 8) | (v4[3] & 0xFF));
        continue;
      }
      if (piece.isEmpty() || piece.length() > 4) {
        return false;
      }
      int value = 0;
      for (int j = 0; j < piece.length(); j++) {
        int digit = hexDigit(piece.charAt(j));
        if (digit < 0) {
          return false;
        }
        value = (value << 4) | digit;
      }
      out.add(value);
    }
    return out.size() <= 8;
  }

  private static int hexDigit(char c) {
    if (c >= '0' && c <= '9') {
      return c - '0';
    }
    if (c >= 'a' && c <= 'f') {
      return c - 'a' + 10;
    }
    if (c >= 'A' && c <= 'F') {
      return c - 'A' + 10;
    }
    return -1;
  }

  private static void putGroup(byte[] out, int index, int value) {
    out[index * 2] = (byte) (value >>> 8);
    out[index * 2 + 1] = (byte) value;
  }
}
