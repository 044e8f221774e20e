package io.b2mash.b2b.dunning.delivery;

import io.b2mash.b2b.dunning.invoice.InvoiceSnapshot;
import io.b2mash.b2b.dunning.notice.DunningNotice;
import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders the dunning email from the classpath template {@code
 * templates/email/dunning-notice.html}. Amounts and dates are formatted here (German locale) so
 * the template only places text.
 */
@Service
public class DunningEmailRenderer {

  private static final Logger log = LoggerFactory.getLogger(DunningEmailRenderer.class);

  private static final String TEMPLATE = "dunning-notice";
  private static final Locale LOCALE = Locale.GERMANY;
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private final SpringTemplateEngine templateEngine;

  public DunningEmailRenderer() {
    this.templateEngine = createTemplateEngine();
  }

  public RenderedEmail render(DunningNotice notice, InvoiceSnapshot invoice) {
    String invoiceNumber =
        invoice.invoiceNumber() != null ? invoice.invoiceNumber() : invoice.invoiceId();
    String subject = notice.getLabel() + " zu Rechnung " + invoiceNumber;

    var ctx = new Context(LOCALE);
    ctx.setVariable("subject", subject);
    ctx.setVariable("label", notice.getLabel());
    ctx.setVariable("finalNotice", notice.getLevel().isTerminal());
    ctx.setVariable("buyerName", invoice.buyerName() != null ? invoice.buyerName() : "Kunde");
    ctx.setVariable("invoiceNumber", invoiceNumber);
    ctx.setVariable("noticeNumber", notice.getNoticeNumber());
    ctx.setVariable("dueDate", invoice.dueDate() != null ? DATE.format(invoice.dueDate()) : "");
    ctx.setVariable("grossAmount", money(notice.getGrossAmount(), notice.getCurrency()));
    ctx.setVariable("fee", money(notice.getFee(), notice.getCurrency()));
    ctx.setVariable("interest", money(notice.getInterest(), notice.getCurrency()));
    ctx.setVariable("totalDue", money(notice.getTotalDue(), notice.getCurrency()));

    String html = templateEngine.process(TEMPLATE, ctx);
    log.debug(
        "Rendered dunning email for notice {}, HTML size={}",
        notice.getNoticeNumber(),
        html.length());
    return new RenderedEmail(subject, html, toPlainText(html));
  }

  static String money(BigDecimal amount, String currency) {
    var format = NumberFormat.getNumberInstance(LOCALE);
    format.setMinimumFractionDigits(amount.scale());
    format.setMaximumFractionDigits(amount.scale());
    return format.format(amount) + " " + (currency != null ? currency : "");
  }

  /** Strips tags and collapses whitespace to produce the plain-text alternative. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = html;
    text = text.replaceAll("(?s)<head>.*?</head>", "");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</td>", " ");
    text = text.replaceAll("<[^>]+>", "");
    text = text.replace("&amp;", "&");
    text = text.replace("&nbsp;", " ");
    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("\\n[ \\t]+", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static SpringTemplateEngine createTemplateEngine() {
    var engine = new SpringTemplateEngine();

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
