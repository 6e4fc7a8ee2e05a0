/**
 * Event-sourced aggregate root with convention-based event handler dispatch.
 *
 * <p>{@link com.keystone.aggregate.AggregateRoot} owns the sequence counter and the uncommitted
 * event buffer. {@link com.keystone.aggregate.EventHandlerTable} binds each event type to one
 * handler method per aggregate class; {@link com.keystone.aggregate.EventHandlerRegistry} caches
 * those tables.
 */
package com.keystone.aggregate;
