/**
 * Recording test doubles for the SPI seams: transaction providers and timing recorders
 * that remember what happened to them.
 */
package com.ryuqq.opwire.testkit.recording;
