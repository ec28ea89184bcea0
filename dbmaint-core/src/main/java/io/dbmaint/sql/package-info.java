/**
 * Statement execution and identifier validation shared by all steps.
 */
package io.dbmaint.sql;
