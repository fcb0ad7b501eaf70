package io.doublezero.globalmonitor.domain.solana;

/**
 * Vote account backing a validator.
 */
public record VoteAccount(String votePubkey, String nodePubkey, long activatedStake) {}
