/// Convergent block encryption primitives.
///
/// - {@link io.chkfs.crypto.ChkCrypto}: hashing, key/IV expansion, length-preserving cipher
/// - {@link io.chkfs.crypto.ContentKey} and {@link io.chkfs.crypto.RetrievalAddress}: the two
///   per-block digests
/// - {@link io.chkfs.crypto.ChkRecord}: the pair of digests that names a block
package io.chkfs.crypto;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
