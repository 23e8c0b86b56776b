// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Deferred concatenation: {@link lazyconcat.concat.LazyConcat} queues fragments and copies them into a contiguous
 * root buffer only when a read needs them there.
 */
package lazyconcat.concat;
