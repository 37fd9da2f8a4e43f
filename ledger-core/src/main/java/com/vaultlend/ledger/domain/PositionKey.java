package com.vaultlend.ledger.domain;

public record PositionKey(String account, String asset) {
}
