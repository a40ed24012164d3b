/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lowcard.types;

import org.lowcard.annotation.Public;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 把类型字符串解析为 {@link DataType}。
 *
 * <p>支持的语法:
 * <pre>
 * type      := name [ '(' length ')' | '&lt;' type { ',' type } '&gt;' ] [ NOT NULL | NULL ]
 * </pre>
 *
 * <p>例如 {@code INT NOT NULL}、{@code CHAR(3)}、{@code ARRAY<DATE>}、
 * {@code DICTIONARY<STRING, UTINYINT>}。类型族由 {@link DataTypeFactory} 解析,
 * 复合类型的参数个数不符时抛出 {@link ArgumentCountMismatchException}。
 *
 * <p>没有后缀的类型是可空的,只有字典类型例外: 它的可空性由元素类型决定。
 */
@Public
public class DataTypeParser {

    private final DataTypeFactory factory;

    public DataTypeParser(DataTypeFactory factory) {
        this.factory = checkNotNull(factory);
    }

    /** 使用默认的类型注册表解析类型字符串。 */
    public static DataType parseDataType(String typeString) {
        return new DataTypeParser(DataTypeFactory.defaultFactory()).parse(typeString);
    }

    public DataType parse(String typeString) {
        List<Token> tokens = tokenize(checkNotNull(typeString, "Type string must not be null."));
        TokenReader reader = new TokenReader(typeString, tokens);
        DataType type = parseType(reader);
        if (reader.hasNext()) {
            throw reader.unexpected(reader.peek());
        }
        return type;
    }

    private DataType parseType(TokenReader reader) {
        Token nameToken = reader.next(TokenType.IDENTIFIER);
        String name = nameToken.text;
        DataType type;
        if (reader.nextIs(TokenType.LEFT_PAREN)) {
            reader.next(TokenType.LEFT_PAREN);
            Token length = reader.next(TokenType.INTEGER);
            reader.next(TokenType.RIGHT_PAREN);
            type = factory.create(name, parseLength(reader, length));
        } else if (reader.nextIs(TokenType.LEFT_ANGLE)) {
            reader.next(TokenType.LEFT_ANGLE);
            List<DataType> arguments = new ArrayList<>();
            arguments.add(parseType(reader));
            while (reader.nextIs(TokenType.COMMA)) {
                reader.next(TokenType.COMMA);
                arguments.add(parseType(reader));
            }
            reader.next(TokenType.RIGHT_ANGLE);
            type = factory.create(name, arguments);
        } else {
            type = factory.create(name);
        }
        return parseNullability(reader, type);
    }

    private static DataType parseNullability(TokenReader reader, DataType type) {
        if (reader.nextIsKeyword("NOT")) {
            reader.next(TokenType.IDENTIFIER);
            Token keyword = reader.next(TokenType.IDENTIFIER);
            if (!keyword.isKeyword("NULL")) {
                throw reader.unexpected(keyword);
            }
            return type.copy(false);
        } else if (reader.nextIsKeyword("NULL")) {
            reader.next(TokenType.IDENTIFIER);
            return type.copy(true);
        }
        return type;
    }

    private static int parseLength(TokenReader reader, Token token) {
        try {
            return Integer.parseInt(token.text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Invalid length '%s' at position %d in type string: %s",
                            token.text, token.position, reader.typeString),
                    e);
        }
    }

    private static List<Token> tokenize(String string) {
        final List<Token> tokens = new ArrayList<>();
        for (int cursor = 0; cursor < string.length(); ) {
            final char c = string.charAt(cursor);
            int nextChar = cursor + 1;
            switch (c) {
                case '(':
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", cursor));
                    break;
                case ')':
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", cursor));
                    break;
                case '<':
                    tokens.add(new Token(TokenType.LEFT_ANGLE, "<", cursor));
                    break;
                case '>':
                    tokens.add(new Token(TokenType.RIGHT_ANGLE, ">", cursor));
                    break;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ",", cursor));
                    break;
                default:
                    if (Character.isDigit(c)) {
                        nextChar = consume(string, cursor, Character::isDigit);
                        tokens.add(
                                new Token(
                                        TokenType.INTEGER,
                                        string.substring(cursor, nextChar),
                                        cursor));
                    } else if (Character.isLetter(c) || c == '_') {
                        nextChar =
                                consume(
                                        string,
                                        cursor,
                                        ch -> Character.isLetterOrDigit(ch) || ch == '_');
                        tokens.add(
                                new Token(
                                        TokenType.IDENTIFIER,
                                        string.substring(cursor, nextChar),
                                        cursor));
                    } else if (!Character.isWhitespace(c)) {
                        throw new IllegalArgumentException(
                                String.format(
                                        "Unexpected character '%s' at position %d in type string: %s",
                                        c, cursor, string));
                    }
            }
            cursor = nextChar;
        }
        return tokens;
    }

    private static int consume(String string, int cursor, CharPredicate predicate) {
        int i = cursor;
        while (i < string.length() && predicate.test(string.charAt(i))) {
            i++;
        }
        return i;
    }

    private interface CharPredicate {
        boolean test(char c);
    }

    private enum TokenType {
        IDENTIFIER,
        INTEGER,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_ANGLE,
        RIGHT_ANGLE,
        COMMA
    }

    private static class Token {
        private final TokenType tokenType;
        private final String text;
        private final int position;

        private Token(TokenType tokenType, String text, int position) {
            this.tokenType = tokenType;
            this.text = text;
            this.position = position;
        }

        private boolean isKeyword(String keyword) {
            return tokenType == TokenType.IDENTIFIER
                    && text.toUpperCase(Locale.ROOT).equals(keyword);
        }
    }

    private static class TokenReader {
        private final String typeString;
        private final List<Token> tokens;
        private int index;

        private TokenReader(String typeString, List<Token> tokens) {
            this.typeString = typeString;
            this.tokens = tokens;
        }

        private boolean hasNext() {
            return index < tokens.size();
        }

        private Token peek() {
            return tokens.get(index);
        }

        private boolean nextIs(TokenType tokenType) {
            return hasNext() && peek().tokenType == tokenType;
        }

        private boolean nextIsKeyword(String keyword) {
            return hasNext() && peek().isKeyword(keyword);
        }

        private Token next(TokenType expected) {
            if (!hasNext()) {
                throw new IllegalArgumentException(
                        String.format(
                                "Unexpected end of type string, expected %s: %s",
                                expected, typeString));
            }
            Token token = tokens.get(index);
            if (token.tokenType != expected) {
                throw unexpected(token);
            }
            index++;
            return token;
        }

        private IllegalArgumentException unexpected(Token token) {
            return new IllegalArgumentException(
                    String.format(
                            "Unexpected token '%s' at position %d in type string: %s",
                            token.text, token.position, typeString));
        }
    }
}
