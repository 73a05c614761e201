package com.acme.mailroute.rules;

import com.acme.mailroute.spi.SenderListManager;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide sender whitelist and blacklist. Addresses are stored lower-cased. A sender moves
 * between lists rather than sitting on both.
 */
@Slf4j
public class SenderLists implements SenderListManager {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Set<String> whitelist = new LinkedHashSet<>();
  private final Set<String> blacklist = new LinkedHashSet<>();

  public List<String> snapshot(ListRef ref) {
    lock.readLock().lock();
    try {
      return List.copyOf(ref == ListRef.SENDER_WHITELIST ? whitelist : blacklist);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void whitelistSender(String address) {
    String a = normalize(address);
    lock.writeLock().lock();
    try {
      blacklist.remove(a);
      whitelist.add(a);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Whitelisted sender {}", a);
  }

  @Override
  public void blockSender(String address) {
    String a = normalize(address);
    lock.writeLock().lock();
    try {
      whitelist.remove(a);
      blacklist.add(a);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Blacklisted sender {}", a);
  }

  public boolean remove(ListRef ref, String address) {
    String a = normalize(address);
    lock.writeLock().lock();
    try {
      return (ref == ListRef.SENDER_WHITELIST ? whitelist : blacklist).remove(a);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private static String normalize(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("Sender address is required");
    }
    return address.trim().toLowerCase(Locale.ROOT);
  }
}
