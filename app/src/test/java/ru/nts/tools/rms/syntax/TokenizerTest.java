/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.rms.syntax;

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Тесты лексического анализатора.
 */
class TokenizerTest {

    /**
     * Токены без пропусков склеиваются обратно в исходный текст, даже если он испорчен.
     */
    @Test
    void testTokensCoverWholeText() {
        String text = """
                /* header */
                #const X 5
                create_land{terrain_type GRASS}
                base_size rnd( 1 , 3 )
                /* unterminated""";
        List<Token> tokens = Tokenizer.tokenize(new SourceText(text));

        String joined = tokens.stream().map(Token::text).collect(Collectors.joining());
        assertEquals(text, joined, "Склейка токенов должна давать исходный текст");
        for (int i = 1; i < tokens.size(); i++) {
            assertEquals(tokens.get(i - 1).endOffset(), tokens.get(i).startOffset(), "Токены должны идти без пропусков");
        }
    }

    @Test
    void testBracesSplitWords() {
        List<Token> tokens = significant("create_land{terrain_type GRASS}");
        assertEquals(List.of("create_land", "{", "terrain_type", "GRASS", "}"),
                tokens.stream().map(Token::text).collect(Collectors.toList()));
        assertEquals(TokenKind.OPEN_BRACE, tokens.get(1).kind());
        assertEquals(TokenKind.CLOSE_BRACE, tokens.get(4).kind());
    }

    @Test
    void testDirectiveAndRndLiteral() {
        List<Token> tokens = significant("#const SIZE rnd(1, 3)");
        assertEquals(TokenKind.DIRECTIVE, tokens.get(0).kind());
        assertEquals(TokenKind.WORD, tokens.get(1).kind());
        assertEquals(TokenKind.RND_LITERAL, tokens.get(2).kind(), "rnd с пробелами внутри скобок остаётся одним токеном");
        assertEquals("rnd(1, 3)", tokens.get(2).text());
    }

    @Test
    void testCommentEndsAtFirstTerminator() {
        List<Token> tokens = significant("/* a */ */ b");
        assertEquals(TokenKind.COMMENT, tokens.get(0).kind());
        assertEquals("/* a */", tokens.get(0).text());
        assertEquals(TokenKind.WORD, tokens.get(1).kind(), "Лишний */ остаётся обычным словом");
    }

    @Test
    void testUnterminatedCommentRunsToEnd() {
        List<Token> tokens = significant("land_percent 10 /* never closed\n create_land");
        Token last = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.COMMENT, last.kind());
        assertTrue(last.text().endsWith("create_land"), "Комментарий должен дойти до конца текста");
    }

    @Test
    void testPositionsAreOneBased() {
        List<Token> tokens = significant("a\n  b");
        Token b = tokens.get(1);
        assertEquals(2, b.span().start().line());
        assertEquals(3, b.span().start().column());
        assertEquals(4, b.startOffset());
    }

    private static List<Token> significant(String text) {
        return Tokenizer.tokenize(new SourceText(text)).stream()
                .filter(token -> token.kind() != TokenKind.WHITESPACE)
                .collect(Collectors.toList());
    }
}
