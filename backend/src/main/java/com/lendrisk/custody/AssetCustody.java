package com.lendrisk.custody;

import java.util.List;

/**
 * Boundary to the asset ledger that holds the actual tokens.
 *
 * <p>The core stages its state change, calls {@link #execute} with every transfer the change requires,
 * and publishes the staged state only if this call returns normally. An implementation must therefore
 * either apply the whole batch or throw without applying any of it.
 */
public interface AssetCustody {

    void execute(String operationId, String operation, List<TransferInstruction> instructions);
}
