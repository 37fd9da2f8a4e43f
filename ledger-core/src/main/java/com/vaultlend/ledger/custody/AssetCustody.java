package com.vaultlend.ledger.custody;

import java.math.BigInteger;

/**
 * Moves fungible assets between external holders and the pool's custody.
 *
 * Implementations fail loudly with {@link CustodyException}; a short transfer is never reported as success.
 */
public interface AssetCustody {

  /**
   * Moves {@code amount} of {@code asset} from {@code from} into custody.
   */
  void pull(String asset, String from, BigInteger amount);

  /**
   * Moves {@code amount} of {@code asset} out of custody to {@code to}.
   */
  void push(String asset, String to, BigInteger amount);
}
