package com.stabilityengine.custody;

import java.math.BigInteger;

/**
 * Receive hook invoked when native value lands in a recipient account.
 *
 * Hooks run inside the operation that issued the transfer, so they observe
 * the engine state that operation has already written. Throwing from a hook
 * rejects the transfer.
 */
public interface NativeTransferListener {

    void onTransferReceived(String recipient, BigInteger amount);
}
