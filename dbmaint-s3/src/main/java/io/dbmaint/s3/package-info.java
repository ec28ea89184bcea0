/**
 * Amazon S3 storage for table dumps.
 */
package io.dbmaint.s3;
