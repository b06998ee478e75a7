/// Tree shape arithmetic and the streaming CHK tree encoder.
///
/// {@link io.chkfs.tree.ChkTreeShape} answers every boundary question (depth, spans, slots,
/// child counts) for a content size. {@link io.chkfs.tree.ChkTreeEncoder} consumes a stream
/// once, emits each {@link io.chkfs.tree.TreeBlock} to a listener and returns the root record.
package io.chkfs.tree;

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
