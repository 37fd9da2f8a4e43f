package com.vaultlend.ledger.domain;

import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.util.Locale;

/**
 * Account and asset identifiers are 20-byte hex addresses, kept lower-case with a {@code 0x} prefix.
 */
public final class Addresses {

  public static final String ZERO = "0x0000000000000000000000000000000000000000";

  private Addresses() {
  }

  public static String normalize(String address) {
    String addr = address == null ? "" : address.trim();
    if (!WalletUtils.isValidAddress(addr)) {
      throw new IllegalArgumentException("Expected 20-byte address hex, got: " + address);
    }
    return Numeric.prependHexPrefix(Numeric.cleanHexPrefix(addr).toLowerCase(Locale.ROOT));
  }

  public static boolean isValid(String address) {
    return address != null && WalletUtils.isValidAddress(address.trim());
  }

  public static boolean isZero(String address) {
    return ZERO.equals(address);
  }

  public static byte[] toBytes(String address) {
    byte[] bytes = Numeric.hexStringToByteArray(normalize(address));
    if (bytes.length != 20) {
      throw new IllegalArgumentException("Expected 20-byte address, got len=" + bytes.length);
    }
    return bytes;
  }
}
