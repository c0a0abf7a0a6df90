package com.williamcallahan.mdcanvas.service.markup;

/**
 * Line-start constructs, declared in the order the block scanner tries them.
 */
enum BlockKind {
    CODE_FENCE,
    CODE_CONTENT,
    HORIZONTAL_RULE,
    LIST_ITEM,
    HEADING,
    BLOCKQUOTE
}
