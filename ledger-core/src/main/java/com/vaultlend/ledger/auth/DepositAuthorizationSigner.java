package com.vaultlend.ledger.auth;

import lombok.NonNull;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Client-side helper producing {@link SignedAuthorization}s for signed deposits.
 */
public final class DepositAuthorizationSigner {

  private DepositAuthorizationSigner() {
  }

  public static SignedAuthorization sign(
      @NonNull Credentials signer,
      @NonNull String asset,
      @NonNull BigInteger amount,
      @NonNull BigInteger nonce,
      @NonNull BigInteger deadline
  ) {
    byte[] hash = DepositAuthorizationMessage.hash(asset, amount, nonce, deadline);
    Sign.SignatureData sig = Sign.signPrefixedMessage(hash, signer.getEcKeyPair());
    return new SignedAuthorization(nonce, deadline, toHex(sig));
  }

  static String toHex(Sign.SignatureData sig) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(sig.getR());
    out.writeBytes(sig.getS());
    out.writeBytes(sig.getV());
    return Numeric.toHexString(out.toByteArray());
  }
}
