package com.vaultlend.ledger.auth;

import com.vaultlend.ledger.domain.Addresses;
import lombok.NonNull;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Canonical message behind a signed deposit:
 * <pre>
 * keccak256(abi.encodePacked("deposit", address asset, uint256 amount, uint256 nonce, uint256 deadline))
 * </pre>
 * The signer signs this 32-byte hash with the Ethereum personal-message prefix.
 */
public final class DepositAuthorizationMessage {

  static final byte[] TAG = "deposit".getBytes(StandardCharsets.UTF_8);

  private DepositAuthorizationMessage() {
  }

  public static byte[] hash(
      @NonNull String asset,
      @NonNull BigInteger amount,
      @NonNull BigInteger nonce,
      @NonNull BigInteger deadline
  ) {
    return Hash.sha3(encodePacked(asset, amount, nonce, deadline));
  }

  static byte[] encodePacked(String asset, BigInteger amount, BigInteger nonce, BigInteger deadline) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(TAG);
    out.writeBytes(Addresses.toBytes(asset));
    out.writeBytes(Numeric.toBytesPadded(amount, 32));
    out.writeBytes(Numeric.toBytesPadded(nonce, 32));
    out.writeBytes(Numeric.toBytesPadded(deadline, 32));
    return out.toByteArray();
  }
}
