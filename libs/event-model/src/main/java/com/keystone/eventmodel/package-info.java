/**
 * Domain event base type and validation helpers for event-sourced aggregates.
 */
package com.keystone.eventmodel;
