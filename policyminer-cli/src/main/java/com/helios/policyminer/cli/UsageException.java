/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.cli;

/**
 * Invalid command line: unknown command or option, missing or malformed value.
 */
class UsageException extends Exception {

    UsageException(String message) {
        super(message);
    }
}
