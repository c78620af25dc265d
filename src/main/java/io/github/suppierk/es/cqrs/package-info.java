/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Defines the event-sourcing contract used by the codebase.
 *
 * <p>Here is an example to help explain how the pieces relate to each other - let's assume that
 * we are shopping online:
 *
 * <ul>
 *   <li>We, as a shopper, are a {@link io.github.suppierk.es.authorization.DomainClient} - we send
 *       {@link io.github.suppierk.es.cqrs.DomainCommand}s such as {@code Open Shopping Cart} or
 *       {@code Confirm Shopping Cart}.
 *   <li>Our shopping cart is never stored as such. What is stored is its stream of {@link
 *       io.github.suppierk.es.cqrs.DomainEvent}s - {@code Shopping Cart Opened}, {@code Product
 *       Item Added To Shopping Cart} and so on.
 *   <li>Whenever the cart is needed, its stream is replayed through an {@link
 *       io.github.suppierk.es.cqrs.Evolver}, giving a {@link io.github.suppierk.es.cqrs.StreamState}
 *       - the cart plus the revision of the stream it was derived from.
 *   <li>A {@link io.github.suppierk.es.cqrs.DomainCommandHandler} looks at that state and either
 *       rejects the command or answers with new events, e.g. confirming an empty cart is rejected.
 *   <li>New events are appended only if the stream is still at the same revision - if somebody
 *       else changed the cart in the meantime, the {@link
 *       io.github.suppierk.es.cqrs.BoundedContext} replays the stream and asks the handler again.
 * </ul>
 */
package io.github.suppierk.es.cqrs;
