package org.javai.tako.ast;

/**
 * Kind of a lowered {@link Value}.
 */
public enum AstNodeType {
	SYMBOL,
	NUMERIC,
	TEXT
}
