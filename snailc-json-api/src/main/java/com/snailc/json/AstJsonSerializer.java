package com.snailc.json;

import com.snailc.ast.Node;
import com.snailc.py.PyNode;

/**
 * Serializes Snail and Python AST nodes to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a Snail AST node. Nodes carry {@code type}, {@code start}, {@code end} and {@code loc}.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a Snail AST node to a pretty-printed JSON string.
     *
     * @param node the AST node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a Python AST node in the shape of the {@code ast} module: {@code _type},
     * snake_case fields and {@code lineno}/{@code col_offset}/{@code end_lineno}/{@code end_col_offset}.
     *
     * @param node the Python node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(PyNode node) throws AstJsonException;

    /**
     * Serializes a Python AST node to a pretty-printed JSON string.
     *
     * @param node the Python node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(PyNode node) throws AstJsonException;
}
