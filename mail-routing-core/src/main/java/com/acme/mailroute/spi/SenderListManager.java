package com.acme.mailroute.spi;

/** Capability behind the block-sender and whitelist-sender actions. */
public interface SenderListManager {
  void blockSender(String address);

  void whitelistSender(String address);
}
