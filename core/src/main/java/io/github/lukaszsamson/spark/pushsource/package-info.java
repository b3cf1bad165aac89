/**
 * Core library for the RabbitMQ push source for Apache Spark.
 *
 * <p>Contains the offset ledger that numbers pushed messages, the durable
 * store adapter it migrates consumed records into, persistence backends,
 * message parsing and option parsing. Nothing here depends on Spark.
 */
package io.github.lukaszsamson.spark.pushsource;
