package com.vaultlend.ledger.auth;

import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import com.vaultlend.ledger.math.Uint256Math;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Instant;
import java.util.Arrays;

/**
 * Checks a {@link SignedAuthorization} for a deposit: uint256 fields, deadline, exact nonce, then signer recovery.
 *
 * The recovered signer must be the submitting account itself. Nonce consumption is the caller's
 * job and happens only once the whole deposit has succeeded.
 */
@Slf4j
public class SignedAuthorizationVerifier {

  private static final int SIGNATURE_LENGTH = 65;

  public void verify(
      String account,
      String asset,
      BigInteger amount,
      SignedAuthorization authorization,
      BigInteger expectedNonce,
      Instant now
  ) {
    if (authorization == null || authorization.nonce() == null || authorization.deadline() == null) {
      throw new LedgerException(LedgerError.INVALID_SIGNATURE, "missing authorization");
    }
    if (!Uint256Math.inRange(authorization.nonce()) || !Uint256Math.inRange(authorization.deadline())) {
      throw LedgerException.of(LedgerError.INVALID_SIGNATURE,
          "nonce %s or deadline %s is not a uint256", authorization.nonce(), authorization.deadline());
    }
    if (BigInteger.valueOf(now.getEpochSecond()).compareTo(authorization.deadline()) > 0) {
      throw LedgerException.of(LedgerError.SIGNATURE_EXPIRED,
          "deadline %s passed (now=%d)", authorization.deadline(), now.getEpochSecond());
    }
    if (!authorization.nonce().equals(expectedNonce)) {
      throw LedgerException.of(LedgerError.INVALID_NONCE,
          "nonce %s does not match expected %s", authorization.nonce(), expectedNonce);
    }

    byte[] hash = DepositAuthorizationMessage.hash(asset, amount, authorization.nonce(), authorization.deadline());
    String signer = recoverSigner(hash, authorization.signature());
    if (Addresses.isZero(signer) || !signer.equals(account)) {
      log.debug("signature signer mismatch (account={}, signer={})", account, signer);
      throw LedgerException.of(LedgerError.INVALID_SIGNATURE, "signature was not produced by %s", account);
    }
  }

  /**
   * Address that produced {@code signatureHex} over the personal-message form of {@code hash}.
   */
  public String recoverSigner(byte[] hash, String signatureHex) {
    Sign.SignatureData sig = parse(signatureHex);
    try {
      BigInteger publicKey = Sign.signedPrefixedMessageToKey(hash, sig);
      return Addresses.normalize(Keys.getAddress(publicKey));
    } catch (SignatureException | RuntimeException e) {
      throw new LedgerException(LedgerError.INVALID_SIGNATURE, "unrecoverable signature: " + e.getMessage());
    }
  }

  private static Sign.SignatureData parse(String signatureHex) {
    byte[] raw;
    try {
      raw = signatureHex == null ? new byte[0] : Numeric.hexStringToByteArray(signatureHex.trim());
    } catch (RuntimeException e) {
      throw new LedgerException(LedgerError.INVALID_SIGNATURE, "signature is not hex");
    }
    if (raw.length != SIGNATURE_LENGTH) {
      throw LedgerException.of(LedgerError.INVALID_SIGNATURE,
          "expected %d-byte signature, got %d", SIGNATURE_LENGTH, raw.length);
    }
    byte v = raw[64];
    if (v < 27) {
      v += 27;
    }
    return new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
  }
}
