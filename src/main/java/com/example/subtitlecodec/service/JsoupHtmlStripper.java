package com.example.subtitlecodec.service;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

/**
 * jsoup-based stripper: cleans against an empty safelist, then decodes the entities
 * the cleaner escaped.
 */
@Component
public class JsoupHtmlStripper implements HtmlStripper {

    private static final Document.OutputSettings OUTPUT = new Document.OutputSettings().prettyPrint(false);

    @Override
    public String strip(String text) {
        if (text == null || text.indexOf('<') < 0) {
            return text;
        }
        String cleaned = Jsoup.clean(text, "", Safelist.none(), OUTPUT);
        return Parser.unescapeEntities(cleaned, false);
    }
}
