package br.edu.ifba.graphqa.resolve;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.HashSet;
import java.util.List;

/**
 * Word lists used by entity resolution, extendable per deployment.
 *
 * <pre>
 * kgqa.taxonomy.org-indicators=university,company,...,center
 * kgqa.taxonomy.domain-words=university,stanford
 * </pre>
 */
@ConfigMapping(prefix = "kgqa.taxonomy")
public interface TaxonomyConfig {

    @WithDefault("university,company,corporation,institute,college,organization,corp,inc,ltd,limited,llc,plc,"
        + "gmbh,associates,partners,group,foundation,bank,solutions,technologies,systems,services,consulting,"
        + "center,centre,agency,association,society,laboratory,labs")
    List<String> orgIndicators();

    @WithDefault("university,stanford")
    List<String> domainWords();

    @WithDefault("who,what,where,when,why,how,does,is,are,the,a,an,about,tell,me,with")
    List<String> queryStopWords();

    @WithDefault("the,a,an,is,are,what,how,theory,principle,of,and,in,on,for,to,who,which,was,were,does,did")
    List<String> topicalStopWords();

    default ResolverTaxonomy toTaxonomy() {
        return new ResolverTaxonomy(
            new HashSet<>(orgIndicators()),
            new HashSet<>(domainWords()),
            new HashSet<>(queryStopWords()),
            new HashSet<>(topicalStopWords()));
    }
}
