/**
 * Handler lookup by task name and construction of adapters from configuration.
 */
package com.sailfish.taskproc.factory;
