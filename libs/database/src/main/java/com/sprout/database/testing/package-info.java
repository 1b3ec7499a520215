/**
 * Test doubles shared across modules: in-memory database settings and a scripted migration tool.
 */
package com.sprout.database.testing;
