/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

/**
 * Thrown when an edit can't be mapped onto the old source, because it is
 * out of bounds, can't be parsed, or conflicts with another edit.
 */
public final class MalformedEditException extends RuntimeException {
    public MalformedEditException(String message) {
        super(message);
    }

    public MalformedEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
