package com.vaultlend.ledger.auth;

import java.math.BigInteger;

/**
 * Off-chain authorization attached to a signed deposit.
 *
 * @param nonce     must equal the account's current nonce
 * @param deadline  last valid second (unix epoch)
 * @param signature 65-byte {@code r || s || v} hex, personal-sign over the deposit message hash
 */
public record SignedAuthorization(BigInteger nonce, BigInteger deadline, String signature) {
}
