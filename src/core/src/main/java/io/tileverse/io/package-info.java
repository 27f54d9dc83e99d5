/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Byte buffer utilities.
 * <p>
 * {@link io.tileverse.io.ChunkBufferPool} is a thread-safe free list of
 * {@link io.tileverse.io.PooledBuffer} instances whose ownership is tracked explicitly: a buffer
 * is either in its pool or acquired by exactly one owner.
 *
 * @since 1.0
 */
package io.tileverse.io;
